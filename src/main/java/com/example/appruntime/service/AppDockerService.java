package com.example.appruntime.service;

import com.example.appruntime.docker.ContainerNotFoundException;
import com.example.appruntime.docker.ContainerRuntime;
import com.example.appruntime.docker.ContainerRuntimeException;
import com.example.appruntime.docker.ContainerSpec;
import com.example.appruntime.docker.ContainerState;
import com.example.appruntime.docker.ContainerSummary;
import com.example.appruntime.docker.LogDemultiplexer;
import com.example.appruntime.exception.UnsupportedSourceTypeException;
import com.example.appruntime.model.App;
import com.example.appruntime.model.AppContainerStatus;
import com.example.appruntime.model.ContainerStatus;
import com.example.appruntime.model.HealthStatus;
import com.example.appruntime.model.NodeInfo;
import com.example.appruntime.repository.AppRepository;
import com.example.appruntime.repository.NodeInfoRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 应用容器生命周期管理：把应用的期望配置映射为容器运行时调用，并负责健康检查。
 * <p>
 * 同一容器的启动、停止、重启、删除经 {@link ContainerLockRegistry} 串行化。
 */
@Service
@Slf4j
public class AppDockerService {

    public static final String APP_LABEL = "phoenixd-app";
    public static final String SOURCE_DOCKER_IMAGE = "docker_image";
    public static final String SOURCE_GITHUB = "github";
    public static final String SOURCE_MARKETPLACE = "marketplace";

    static final String ENV_DASHBOARD_URL = "PHOENIXD_DASHBOARD_URL";
    static final String ENV_API_KEY = "PHOENIXD_APP_API_KEY";
    static final String ENV_WEBHOOK_SECRET = "PHOENIXD_WEBHOOK_SECRET";
    static final String ENV_NODE_ID = "PHOENIXD_NODE_ID";
    static final String ENV_CHAIN = "PHOENIXD_CHAIN";
    static final String ENV_IS_EXTERNAL = "PHOENIXD_IS_EXTERNAL";

    private static final int STOP_GRACE_SECONDS = 10;
    private static final Duration HEALTH_GRACE = Duration.ofSeconds(5);

    private final ContainerRuntime runtime;
    private final AppRepository appRepository;
    private final NodeInfoRepository nodeInfoRepository;
    private final LiveBackendConfig liveConfig;
    private final ContainerLockRegistry locks;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final HttpClient httpClient;

    @Value("${app.dashboard.url:http://phoenixd-backend:4000}")
    private String dashboardUrl = "http://phoenixd-backend:4000";

    @Value("${app.docker.network:phoenixd-dashboard_phoenixd-network}")
    private String network = "phoenixd-dashboard_phoenixd-network";

    @Value("${app.docker.compose-project:phoenixd-dashboard}")
    private String composeProject = "phoenixd-dashboard";

    @Value("${app.docker.memory-limit-mb:512}")
    private long memoryLimitMb = 512;

    @Value("${app.docker.nano-cpus:1000000000}")
    private long nanoCpus = 1_000_000_000L;

    @Value("${app.health.timeout:5s}")
    private Duration healthTimeout = Duration.ofSeconds(5);

    public AppDockerService(ContainerRuntime runtime,
            AppRepository appRepository,
            NodeInfoRepository nodeInfoRepository,
            LiveBackendConfig liveConfig,
            ContainerLockRegistry locks,
            ObjectMapper objectMapper,
            @Qualifier("taskExecutor") Executor executor) {
        this.runtime = runtime;
        this.appRepository = appRepository;
        this.nodeInfoRepository = nodeInfoRepository;
        this.liveConfig = liveConfig;
        this.locks = locks;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * 拉取应用镜像。
     *
     * @param sourceType 来源类型
     * @param sourceUrl  镜像地址
     * @param version    版本（tag）
     * @throws UnsupportedSourceTypeException 来源类型尚未实现（如 github）
     */
    public void pullImage(String sourceType, String sourceUrl, String version) {
        if (!SOURCE_DOCKER_IMAGE.equals(sourceType) && !SOURCE_MARKETPLACE.equals(sourceType)) {
            throw new UnsupportedSourceTypeException(sourceType);
        }

        String image = imageReference(sourceUrl, version);
        log.info("[Lifecycle] Pulling image {}", image);
        runtime.pull(image, progress -> log.debug("[Lifecycle] Pull {}: {}", image, progress));
        log.info("[Lifecycle] Pulled image {}", image);
    }

    /**
     * 启动应用容器。幂等：运行中则不做任何操作，已停止则原地启动，不存在则创建后启动。
     */
    public void startApp(App app) {
        String name = requireContainerName(app);
        locks.withLock(name, () -> doStart(app, name));
    }

    /**
     * 停止应用容器。幂等：不存在或已停止都视为成功。
     */
    public void stopApp(App app) {
        String name = requireContainerName(app);
        locks.withLock(name, () -> doStop(name));
    }

    /**
     * 重启应用。运行中的容器无法修改环境变量，因此先停止、删除，再按最新配置重新创建。
     */
    public void restartApp(App app) {
        String name = requireContainerName(app);
        locks.withLock(name, () -> {
            try {
                ContainerState state = runtime.inspect(name);
                if (state.running()) {
                    runtime.stop(name, STOP_GRACE_SECONDS);
                }
                runtime.remove(name, false);
                log.info("[Lifecycle] Removed {} for recreation", name);
            } catch (ContainerNotFoundException e) {
                log.debug("[Lifecycle] {} absent before restart", name);
            }
            doStart(app, name);
        });
    }

    /**
     * 删除容器。幂等：不存在时直接返回。
     */
    public void removeContainer(String containerName) {
        locks.withLock(containerName, () -> {
            try {
                ContainerState state = runtime.inspect(containerName);
                if (state.running()) {
                    runtime.stop(containerName, STOP_GRACE_SECONDS);
                }
            } catch (ContainerNotFoundException e) {
                log.info("[Lifecycle] Container {} not found", containerName);
                return;
            } catch (ContainerRuntimeException e) {
                // 强制删除仍会终止容器
                log.warn("[Lifecycle] Stop before remove failed for {}: {}", containerName, e.getMessage());
            }

            try {
                runtime.remove(containerName, true);
                log.info("[Lifecycle] Container {} removed", containerName);
            } catch (ContainerNotFoundException e) {
                log.info("[Lifecycle] Container {} already gone", containerName);
            }
        });
    }

    /**
     * 获取最近的容器日志（已解复用）。
     *
     * @param containerName 容器名
     * @param tail          行数
     * @return 日志文本
     */
    public String getLogs(String containerName, int tail) {
        try (InputStream in = runtime.logs(containerName, tail, false)) {
            return LogDemultiplexer.demux(in.readAllBytes());
        } catch (ContainerNotFoundException e) {
            return "Container not found";
        } catch (IOException e) {
            throw new ContainerRuntimeException("Failed to read logs of " + containerName, e);
        }
    }

    /**
     * 注入到应用容器的环境变量，顺序固定：基础设施变量、节点信息、外部标记、用户变量。
     * <p>
     * 键重复时全部保留，由容器运行时按 "后者覆盖前者" 生效，因此用户变量可以覆盖基础设施变量。
     *
     * @param app 应用
     * @return KEY=VALUE 列表
     */
    public List<String> getAppEnvVars(App app) {
        List<String> env = new ArrayList<>();

        env.add(ENV_DASHBOARD_URL + "=" + dashboardUrl);
        env.add(ENV_API_KEY + "=" + nullToEmpty(app.getApiKey()));
        env.add(ENV_WEBHOOK_SECRET + "=" + nullToEmpty(app.getWebhookSecret()));

        try {
            Optional<NodeInfo> cached = nodeInfoRepository.findById(NodeInfo.SINGLETON_ID);
            if (cached.isPresent()) {
                env.add(ENV_NODE_ID + "=" + nullToEmpty(cached.get().getNodeId()));
                env.add(ENV_CHAIN + "=" + nullToEmpty(cached.get().getChain()));
            } else {
                log.debug("[Lifecycle] No cached node info for {}", app.getSlug());
            }
        } catch (RuntimeException e) {
            log.error("[Lifecycle] Error reading node info for app env vars", e);
        }

        env.add(ENV_IS_EXTERNAL + "=" + liveConfig.isExternal());

        if (app.getEnvVars() != null && !app.getEnvVars().isBlank()) {
            try {
                Map<String, Object> custom = objectMapper.readValue(app.getEnvVars(),
                        new TypeReference<LinkedHashMap<String, Object>>() {
                        });
                custom.forEach((key, value) -> env.add(key + "=" + (value == null ? "" : value)));
            } catch (IOException e) {
                log.error("[Lifecycle] Ignoring malformed envVars for {}: {}", app.getSlug(), e.getMessage());
            }
        }

        return env;
    }

    /**
     * 应用在内部网络中的地址，用于 Webhook 投递和健康检查。
     *
     * @throws IllegalStateException 应用没有容器名
     */
    public String getAppInternalUrl(App app) {
        return "http://" + requireContainerName(app) + ":" + app.getInternalPort();
    }

    /**
     * 查询容器实时状态。任何错误都映射为状态值，不会抛出。
     */
    public AppContainerStatus getContainerStatus(String containerName) {
        try {
            ContainerState state = runtime.inspect(containerName);
            HealthStatus health = HealthStatus.UNKNOWN;
            if (state.health() != null) {
                health = "healthy".equals(state.health()) ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
            }
            return new AppContainerStatus(
                    state.running() ? ContainerStatus.RUNNING : ContainerStatus.STOPPED,
                    health,
                    state.running());
        } catch (ContainerNotFoundException e) {
            return AppContainerStatus.notFound();
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] Inspect failed for {}: {}", containerName, e.getMessage());
            return AppContainerStatus.error();
        }
    }

    /**
     * 列出所有带应用标签的容器。
     */
    public List<ContainerSummary> listAppContainers() {
        return runtime.list(Map.of(APP_LABEL, "true"));
    }

    /**
     * 请求应用自身的 /health。非 2xx、超时或网络错误都视为不健康，从不抛出。
     */
    public HealthStatus healthCheck(App app) {
        if (app.getContainerName() == null || app.getContainerStatus() != ContainerStatus.RUNNING) {
            return HealthStatus.UNHEALTHY;
        }

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(getAppInternalUrl(app) + "/health"))
                    .timeout(healthTimeout)
                    .GET()
                    .build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            return status >= 200 && status < 300 ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.UNHEALTHY;
        } catch (Exception e) {
            log.debug("[Health] {} unreachable: {}", app.getSlug(), e.getMessage());
            return HealthStatus.UNHEALTHY;
        }
    }

    /**
     * 并发检查所有缓存状态为 running 的应用，单个应用失败不影响其他应用。
     *
     * @return 成功写回健康状态的应用数
     */
    public int updateAllHealthStatuses() {
        List<App> apps = appRepository.findByContainerStatus(ContainerStatus.RUNNING);
        AtomicInteger updated = new AtomicInteger();
        // 排队等待也计入上限
        long deadlineMillis = healthTimeout.plus(HEALTH_GRACE).toMillis();

        CompletableFuture<?>[] checks = apps.stream()
                .map(app -> CompletableFuture
                        .runAsync(() -> {
                            HealthStatus health = healthCheck(app);
                            appRepository.updateHealth(app.getId(), health, LocalDateTime.now());
                            updated.incrementAndGet();
                        }, executor)
                        .orTimeout(deadlineMillis, TimeUnit.MILLISECONDS)
                        .exceptionally(e -> {
                            log.error("[Health] Error checking health for app {}", app.getSlug(), e);
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);

        CompletableFuture.allOf(checks).join();
        log.info("[Health] Checked {} running apps, {} updated", apps.size(), updated.get());
        return updated.get();
    }

    /**
     * 镜像引用：sourceUrl 已带 tag 则直接使用，否则追加版本。
     */
    static String imageReference(String sourceUrl, String version) {
        boolean tagged = sourceUrl.lastIndexOf(':') > sourceUrl.lastIndexOf('/');
        if (tagged) {
            return sourceUrl;
        }
        return sourceUrl + ":" + (version == null || version.isBlank() ? "latest" : version);
    }

    private void doStart(App app, String name) {
        try {
            ContainerState state = runtime.inspect(name);
            if (state.running()) {
                log.info("[Lifecycle] Container {} is already running", name);
                return;
            }
            log.info("[Lifecycle] Starting existing container {}", name);
            runtime.start(name);
            return;
        } catch (ContainerNotFoundException e) {
            // 不存在，走创建流程
        }

        String image = imageReference(app.getSourceUrl(), app.getVersion());
        log.info("[Lifecycle] Creating container {} from image {}", name, image);

        ContainerSpec spec = ContainerSpec.builder()
                .name(name)
                .image(image)
                .env(getAppEnvVars(app))
                .label(APP_LABEL, "true")
                .label(APP_LABEL + ".id", String.valueOf(app.getId()))
                .label(APP_LABEL + ".slug", app.getSlug())
                .label("com.docker.compose.project", composeProject)
                .network(network)
                .memoryBytes(memoryLimitMb * 1024 * 1024)
                .nanoCpus(nanoCpus)
                .restartPolicy("unless-stopped")
                .healthcheckTest(List.of("CMD-SHELL",
                        "curl -f http://localhost:" + app.getInternalPort() + "/health || exit 1"))
                .healthcheckInterval(Duration.ofSeconds(30))
                .healthcheckTimeout(Duration.ofSeconds(10))
                .healthcheckRetries(3)
                .healthcheckStartPeriod(Duration.ofSeconds(30))
                .build();

        runtime.create(spec);
        runtime.start(name);
        log.info("[Lifecycle] Container {} started successfully", name);
    }

    private void doStop(String name) {
        try {
            ContainerState state = runtime.inspect(name);
            if (!state.running()) {
                log.info("[Lifecycle] Container {} is already stopped", name);
                return;
            }
            log.info("[Lifecycle] Stopping container {}", name);
            runtime.stop(name, STOP_GRACE_SECONDS);
            log.info("[Lifecycle] Container {} stopped successfully", name);
        } catch (ContainerNotFoundException e) {
            log.info("[Lifecycle] Container {} not found", name);
        }
    }

    private static String requireContainerName(App app) {
        if (app.getContainerName() == null || app.getContainerName().isBlank()) {
            throw new IllegalStateException("App has no container name: " + app.getSlug());
        }
        return app.getContainerName();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
