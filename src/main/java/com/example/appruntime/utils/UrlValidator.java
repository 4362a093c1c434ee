package com.example.appruntime.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 节点连接地址校验。
 * <p>
 * 节点通常部署在内网（如 http://phoenixd:9740），因此这里只校验格式，不做内网地址拦截。
 */
@Component
@Slf4j
public class UrlValidator {

    /**
     * 校验并返回规范化后的地址（去掉末尾的 /）。
     *
     * @throws IllegalArgumentException 地址不合法
     */
    public String validate(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }

        URI uri;
        try {
            uri = new URI(url.trim()).normalize();
        } catch (URISyntaxException e) {
            log.warn("[UrlValidator] Malformed URL {}: {}", url, e.getMessage());
            throw new IllegalArgumentException("Invalid URL format");
        }

        // 协议白名单
        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Unsupported protocol: " + scheme);
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be empty");
        }

        if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
            throw new IllegalArgumentException("Wildcard address is not a valid node host: " + host);
        }

        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new IllegalArgumentException("URL must not contain query or fragment");
        }

        String normalized = uri.toString();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * 快速判断地址是否合法。
     */
    public boolean isValidUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
