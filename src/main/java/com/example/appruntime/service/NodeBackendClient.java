package com.example.appruntime.service;

import com.example.appruntime.exception.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * phoenixd HTTP API 客户端。普通调用读取 {@link LiveBackendConfig}，连接测试使用传入的地址与密码。
 */
@Service
@Slf4j
public class NodeBackendClient {

    /**
     * 节点身份探测结果。
     */
    public record NodeIdentity(String nodeId, String chain, String version) {
    }

    private final LiveBackendConfig liveConfig;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public NodeBackendClient(LiveBackendConfig liveConfig,
            ObjectMapper objectMapper,
            @Value("${app.phoenixd.request-timeout:10s}") Duration requestTimeout) {
        this.liveConfig = liveConfig;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * 用给定凭据探测节点身份。失败时抛出带描述的异常，绝不返回占位身份。
     *
     * @param url      节点地址
     * @param password HTTP 密码
     * @return 节点身份
     */
    public NodeIdentity testConnection(String url, String password) {
        JsonNode info = getJson(url, password, "/getinfo");
        if (!info.hasNonNull("nodeId")) {
            throw new UpstreamException("Connection failed: response has no nodeId");
        }
        return new NodeIdentity(
                info.get("nodeId").asText(),
                info.hasNonNull("chain") ? info.get("chain").asText() : null,
                info.hasNonNull("version") ? info.get("version").asText() : null);
    }

    /**
     * 通过当前 active 配置获取节点信息。
     */
    public NodeIdentity getInfo() {
        LiveBackendConfig.Target target = liveConfig.current();
        return testConnection(target.url(), target.password());
    }

    static String basicAuth(String password) {
        String credentials = ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private JsonNode getJson(String baseUrl, String password, String endpoint) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + endpoint))
                    .timeout(requestTimeout)
                    .header("Authorization", basicAuth(password))
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new UpstreamException("Connection failed: invalid URL " + baseUrl, e);
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new UpstreamException("Connection failed: " + response.statusCode() + " - " + response.body());
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            log.debug("phoenixd request to {} failed", baseUrl, e);
            throw new UpstreamException("Connection failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Connection failed: interrupted", e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
