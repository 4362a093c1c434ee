package com.example.appruntime.service;

import com.example.appruntime.docker.ContainerSpec;
import com.example.appruntime.docker.ContainerSummary;
import com.example.appruntime.exception.UnsupportedSourceTypeException;
import com.example.appruntime.model.App;
import com.example.appruntime.model.AppContainerStatus;
import com.example.appruntime.model.ContainerStatus;
import com.example.appruntime.model.HealthStatus;
import com.example.appruntime.model.NodeInfo;
import com.example.appruntime.repository.AppRepository;
import com.example.appruntime.repository.NodeInfoRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AppDockerServiceTest {

    private static final String CONTAINER = "phoenixd-app-donations";

    private FakeContainerRuntime runtime;
    private AppRepository appRepository;
    private NodeInfoRepository nodeInfoRepository;
    private LiveBackendConfig liveConfig;
    private AppDockerService service;
    private HttpServer server;

    @BeforeEach
    void setUp() {
        runtime = new FakeContainerRuntime();
        appRepository = mock(AppRepository.class);
        nodeInfoRepository = mock(NodeInfoRepository.class);
        liveConfig = new LiveBackendConfig("http://phoenixd:9740", "docker-secret");
        service = new AppDockerService(runtime, appRepository, nodeInfoRepository, liveConfig,
                new ContainerLockRegistry(Duration.ofSeconds(5)), new ObjectMapper(), Runnable::run);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void testStartIsIdempotent() {
        App app = donations();

        service.startApp(app);
        service.startApp(app);

        assertEquals(1, runtime.count("create:" + CONTAINER));
        assertEquals(1, runtime.count("start:" + CONTAINER));
        assertTrue(runtime.containers.get(CONTAINER).running);
    }

    @Test
    void testStartStoppedContainerInPlace() {
        runtime.addContainer(CONTAINER, false);

        service.startApp(donations());

        assertEquals(0, runtime.count("create:" + CONTAINER));
        assertEquals(1, runtime.count("start:" + CONTAINER));
    }

    @Test
    void testCreatedContainerSpec() {
        service.startApp(donations());

        ContainerSpec spec = runtime.containers.get(CONTAINER).spec;
        assertEquals("ghcr.io/example/donations:latest", spec.image());
        assertEquals("true", spec.labels().get(AppDockerService.APP_LABEL));
        assertEquals("7", spec.labels().get("phoenixd-app.id"));
        assertEquals("donations", spec.labels().get("phoenixd-app.slug"));
        assertEquals("phoenixd-dashboard_phoenixd-network", spec.network());
        assertEquals(512L * 1024 * 1024, spec.memoryBytes());
        assertEquals(1_000_000_000L, spec.nanoCpus());
        assertEquals("unless-stopped", spec.restartPolicy());
        assertEquals(List.of("CMD-SHELL", "curl -f http://localhost:3000/health || exit 1"), spec.healthcheckTest());
        assertEquals(3, spec.healthcheckRetries());
    }

    @Test
    void testStopIsIdempotent() {
        App app = donations();

        // 不存在
        assertDoesNotThrow(() -> service.stopApp(app));

        runtime.addContainer(CONTAINER, true);
        service.stopApp(app);
        service.stopApp(app);

        assertEquals(1, runtime.count("stop:" + CONTAINER));
        assertFalse(runtime.containers.get(CONTAINER).running);
    }

    @Test
    void testRemoveContainerIsIdempotent() {
        runtime.addContainer(CONTAINER, true);

        service.removeContainer(CONTAINER);
        service.removeContainer(CONTAINER);

        assertFalse(runtime.containers.containsKey(CONTAINER));
        assertEquals(1, runtime.count("remove:" + CONTAINER));
    }

    @Test
    void testRestartRecreatesWithLatestConfig() {
        App app = donations();
        service.startApp(app);

        app.setEnvVars("{\"GOAL\":\"2000\"}");
        service.restartApp(app);

        assertEquals(2, runtime.count("create:" + CONTAINER));
        assertEquals(1, runtime.count("stop:" + CONTAINER));
        assertEquals(1, runtime.count("remove:" + CONTAINER));
        assertTrue(runtime.containers.get(CONTAINER).running);
        assertTrue(runtime.containers.get(CONTAINER).spec.env().contains("GOAL=2000"));
    }

    @Test
    void testRestartAbsentContainerCreatesIt() {
        service.restartApp(donations());

        assertEquals(1, runtime.count("create:" + CONTAINER));
        assertTrue(runtime.containers.get(CONTAINER).running);
    }

    @Test
    void testEnvVarsOrderAndOverride() {
        when(nodeInfoRepository.findById(NodeInfo.SINGLETON_ID)).thenReturn(Optional.of(
                NodeInfo.builder().nodeId("03abc").chain("mainnet").build()));
        App app = donations();
        app.setEnvVars("{\"PHOENIXD_CHAIN\":\"regtest\",\"GOAL\":1000}");

        List<String> env = service.getAppEnvVars(app);

        assertEquals(List.of(
                "PHOENIXD_DASHBOARD_URL=http://phoenixd-backend:4000",
                "PHOENIXD_APP_API_KEY=phxapp_key",
                "PHOENIXD_WEBHOOK_SECRET=secret",
                "PHOENIXD_NODE_ID=03abc",
                "PHOENIXD_CHAIN=mainnet",
                "PHOENIXD_IS_EXTERNAL=false",
                "PHOENIXD_CHAIN=regtest",
                "GOAL=1000"), env);
    }

    @Test
    void testExternalFlagFollowsLiveConfig() {
        liveConfig.apply("https://node.example.com", "pw", true);

        List<String> env = service.getAppEnvVars(donations());

        assertTrue(env.contains("PHOENIXD_IS_EXTERNAL=true"));
    }

    @Test
    void testMalformedEnvVarsIgnored() {
        when(nodeInfoRepository.findById(NodeInfo.SINGLETON_ID)).thenReturn(Optional.empty());
        App app = donations();
        app.setEnvVars("{not json");

        List<String> env = service.getAppEnvVars(app);

        assertEquals(4, env.size());
        assertTrue(env.stream().noneMatch(e -> e.startsWith(AppDockerService.ENV_NODE_ID)));
    }

    @Test
    void testNodeInfoFailureTolerated() {
        when(nodeInfoRepository.findById(NodeInfo.SINGLETON_ID)).thenThrow(new IllegalStateException("db down"));

        List<String> env = service.getAppEnvVars(donations());

        assertEquals("PHOENIXD_IS_EXTERNAL=false", env.get(env.size() - 1));
    }

    @Test
    void testContainerStatusMapping() {
        AppContainerStatus absent = service.getContainerStatus(CONTAINER);
        assertEquals(ContainerStatus.NOT_FOUND, absent.containerStatus());
        assertEquals(HealthStatus.UNKNOWN, absent.healthStatus());

        runtime.addContainer(CONTAINER, true);
        runtime.containers.get(CONTAINER).health = "healthy";
        AppContainerStatus healthy = service.getContainerStatus(CONTAINER);
        assertEquals(ContainerStatus.RUNNING, healthy.containerStatus());
        assertEquals(HealthStatus.HEALTHY, healthy.healthStatus());
        assertTrue(healthy.running());

        runtime.containers.get(CONTAINER).running = false;
        runtime.containers.get(CONTAINER).health = null;
        AppContainerStatus stopped = service.getContainerStatus(CONTAINER);
        assertEquals(ContainerStatus.STOPPED, stopped.containerStatus());
        assertEquals(HealthStatus.UNKNOWN, stopped.healthStatus());

        runtime.failingInspect.add(CONTAINER);
        AppContainerStatus error = service.getContainerStatus(CONTAINER);
        assertEquals(ContainerStatus.ERROR, error.containerStatus());
        assertEquals(HealthStatus.UNHEALTHY, error.healthStatus());
    }

    @Test
    void testGithubSourceIsNotImplemented() {
        assertThrows(UnsupportedSourceTypeException.class,
                () -> service.pullImage("github", "https://github.com/example/app", "main"));
        assertTrue(runtime.calls.isEmpty());
    }

    @Test
    void testPullImage() {
        service.pullImage("docker_image", "ghcr.io/example/donations", "1.2.0");
        service.pullImage("marketplace", "ghcr.io/example/tips:0.3", "latest");

        assertTrue(runtime.pulledImages.contains("ghcr.io/example/donations:1.2.0"));
        assertTrue(runtime.pulledImages.contains("ghcr.io/example/tips:0.3"));
    }

    @Test
    void testImageReference() {
        assertEquals("ghcr.io/example/app:1.2", AppDockerService.imageReference("ghcr.io/example/app:1.2", "9"));
        assertEquals("localhost:5000/app:2", AppDockerService.imageReference("localhost:5000/app", "2"));
        assertEquals("nginx:latest", AppDockerService.imageReference("nginx", null));
    }

    @Test
    void testInternalUrl() {
        assertEquals("http://phoenixd-app-donations:3000", service.getAppInternalUrl(donations()));

        App noContainer = donations();
        noContainer.setContainerName(null);
        assertThrows(IllegalStateException.class, () -> service.getAppInternalUrl(noContainer));
    }

    @Test
    void testGetLogsDemultiplexes() {
        runtime.addContainer(CONTAINER, true);
        runtime.logBytes = concat(frame(1, "hello "), frame(2, "world"));

        assertEquals("hello world", service.getLogs(CONTAINER, 100));
        assertEquals("Container not found", service.getLogs("phoenixd-app-missing", 100));
    }

    @Test
    void testListAppContainers() {
        service.startApp(donations());
        runtime.addContainer("unrelated", true);

        List<ContainerSummary> containers = service.listAppContainers();

        assertEquals(1, containers.size());
        assertEquals(CONTAINER, containers.get(0).name());
    }

    @Test
    void testHealthCheckOnlyForRunningApps() {
        App stopped = donations();
        stopped.setContainerStatus(ContainerStatus.STOPPED);

        assertEquals(HealthStatus.UNHEALTHY, service.healthCheck(stopped));
    }

    @Test
    void testHealthCheck() throws IOException {
        int port = startServer(200);
        App app = localApp(1L, port);

        assertEquals(HealthStatus.HEALTHY, service.healthCheck(app));
    }

    @Test
    void testHealthCheckNon2xx() throws IOException {
        int port = startServer(503);

        assertEquals(HealthStatus.UNHEALTHY, service.healthCheck(localApp(1L, port)));
    }

    @Test
    void testHealthSweepIsolatesFailures() throws IOException {
        int healthyPort = startServer(200);
        App healthy = localApp(1L, healthyPort);
        App unreachable = localApp(2L, freePort());
        App brokenRecord = localApp(3L, healthyPort);
        when(appRepository.findByContainerStatus(ContainerStatus.RUNNING))
                .thenReturn(List.of(healthy, unreachable, brokenRecord));
        when(appRepository.updateHealth(eq(3L), any(), any())).thenThrow(new IllegalStateException("db error"));

        int updated = service.updateAllHealthStatuses();

        assertEquals(2, updated);
        verify(appRepository).updateHealth(eq(1L), eq(HealthStatus.HEALTHY), any());
        verify(appRepository).updateHealth(eq(2L), eq(HealthStatus.UNHEALTHY), any());
    }

    private App donations() {
        return App.builder()
                .id(7L)
                .name("Donations")
                .slug("donations")
                .sourceType("docker_image")
                .sourceUrl("ghcr.io/example/donations")
                .containerName(CONTAINER)
                .containerStatus(ContainerStatus.RUNNING)
                .apiKey("phxapp_key")
                .webhookSecret("secret")
                .build();
    }

    private App localApp(Long id, int port) {
        return App.builder()
                .id(id)
                .name("App " + id)
                .slug("app-" + id)
                .sourceType("docker_image")
                .sourceUrl("example/app")
                .containerName("localhost")
                .containerStatus(ContainerStatus.RUNNING)
                .internalPort(port)
                .build();
    }

    private int startServer(int status) throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
        return server.getAddress().getPort();
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static byte[] frame(int streamType, String payload) {
        byte[] data = payload.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(8 + data.length)
                .put((byte) streamType)
                .put(new byte[3])
                .putInt(data.length)
                .put(data)
                .array();
    }

    private static byte[] concat(byte[] first, byte[] second) {
        return ByteBuffer.allocate(first.length + second.length).put(first).put(second).array();
    }
}
