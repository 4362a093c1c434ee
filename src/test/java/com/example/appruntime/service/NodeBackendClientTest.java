package com.example.appruntime.service;

import com.example.appruntime.exception.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NodeBackendClientTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{\"nodeId\":\"03abc\",\"chain\":\"mainnet\",\"version\":\"0.4.2\"}";

    private NodeBackendClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/getinfo", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        LiveBackendConfig liveConfig = new LiveBackendConfig(baseUrl, "docker-secret");
        client = new NodeBackendClient(liveConfig, new ObjectMapper(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testConnectionReturnsIdentity() {
        NodeBackendClient.NodeIdentity identity = client.testConnection(baseUrl, "pw");

        assertEquals("03abc", identity.nodeId());
        assertEquals("mainnet", identity.chain());
        assertEquals("0.4.2", identity.version());
        assertEquals("Basic OnB3", authorization.get());
    }

    @Test
    void testGetInfoUsesLiveConfig() {
        client.getInfo();

        assertEquals(NodeBackendClient.basicAuth("docker-secret"), authorization.get());
    }

    @Test
    void testRejectedCredentials() {
        status = 401;
        body = "Unauthorized";

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.testConnection(baseUrl, "bad"));
        assertEquals("Connection failed: 401 - Unauthorized", e.getMessage());
    }

    @Test
    void testResponseWithoutNodeId() {
        body = "{\"chain\":\"mainnet\"}";

        assertThrows(UpstreamException.class, () -> client.testConnection(baseUrl, "pw"));
    }

    @Test
    void testUnreachableNode() {
        UpstreamException e = assertThrows(UpstreamException.class,
                () -> client.testConnection("http://127.0.0.1:1", "pw"));
        assertTrue(e.getMessage().startsWith("Connection failed"));
    }
}
