package com.example.appruntime.service;

import com.example.appruntime.docker.ContainerSummary;
import com.example.appruntime.exception.ResourceNotFoundException;
import com.example.appruntime.exception.ValidationException;
import com.example.appruntime.model.App;
import com.example.appruntime.model.AppContainerStatus;
import com.example.appruntime.model.AppRequest;
import com.example.appruntime.model.ContainerStatus;
import com.example.appruntime.model.HealthStatus;
import com.example.appruntime.model.WebhookEventType;
import com.example.appruntime.repository.AppRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * 应用安装与管理：记录的增删改，以及把管理操作转交给 {@link AppDockerService}。
 */
@Service
@Slf4j
public class AppService {

    public static final String CONTAINER_PREFIX = "phoenixd-app-";
    public static final String API_KEY_PREFIX = "phxapp_";

    public static final List<String> SOURCE_TYPES = List.of(
            AppDockerService.SOURCE_DOCKER_IMAGE,
            AppDockerService.SOURCE_GITHUB,
            AppDockerService.SOURCE_MARKETPLACE);

    public static final List<String> API_PERMISSIONS = List.of(
            "read:balance",
            "read:payments",
            "read:channels",
            "read:node",
            "write:invoices",
            "write:payments");

    static final List<String> DEFAULT_PERMISSIONS = List.of("read:balance", "read:payments");

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AppRepository appRepository;
    private final AppDockerService appDockerService;
    private final ObjectMapper objectMapper;

    public AppService(AppRepository appRepository, AppDockerService appDockerService, ObjectMapper objectMapper) {
        this.appRepository = appRepository;
        this.appDockerService = appDockerService;
        this.objectMapper = objectMapper;
    }

    public List<App> listApps() {
        return appRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(AppService::masked)
                .toList();
    }

    public App getApp(Long id) {
        return masked(findApp(id));
    }

    public App findApp(Long id) {
        return appRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("App not found"));
    }

    /**
     * 安装应用：校验、生成标识与凭据、保存记录，然后拉取镜像。
     * <p>
     * 拉取失败不影响安装结果，应用被标记为 error / unhealthy。返回值包含完整 API Key，仅此一次。
     *
     * @throws ValidationException 请求非法
     */
    public App installApp(AppRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Name is required");
        }
        if (request.getSourceType() == null || !SOURCE_TYPES.contains(request.getSourceType())) {
            throw new ValidationException("Invalid source type. Valid: " + String.join(", ", SOURCE_TYPES));
        }
        if (request.getSourceUrl() == null || request.getSourceUrl().isBlank()) {
            throw new ValidationException("Source URL is required");
        }
        validateEvents(request.getWebhookEvents());
        validatePermissions(request.getApiPermissions());
        validatePort(request.getInternalPort());

        String slug = generateSlug(request.getName());
        if (slug.isEmpty()) {
            throw new ValidationException("Name must contain letters or digits");
        }
        if (appRepository.existsBySlug(slug)) {
            slug = slug + "-" + System.currentTimeMillis();
        }

        App app = App.builder()
                .name(request.getName().trim())
                .slug(slug)
                .description(emptyToNull(request.getDescription()))
                .icon(emptyToNull(request.getIcon()))
                .sourceType(request.getSourceType())
                .sourceUrl(request.getSourceUrl().trim())
                .version(request.getVersion() == null || request.getVersion().isBlank()
                        ? "latest" : request.getVersion())
                .containerName(CONTAINER_PREFIX + slug)
                .containerStatus(ContainerStatus.STOPPED)
                .internalPort(request.getInternalPort() != null ? request.getInternalPort() : 3000)
                .envVars(request.getEnvVars() != null ? toJson(request.getEnvVars()) : null)
                .webhookEvents(request.getWebhookEvents() != null ? toJson(request.getWebhookEvents()) : null)
                .webhookSecret(generateWebhookSecret())
                .webhookPath(request.getWebhookPath() == null || request.getWebhookPath().isBlank()
                        ? "/webhook" : request.getWebhookPath())
                .apiKey(generateApiKey())
                .apiPermissions(toJson(request.getApiPermissions() != null
                        ? request.getApiPermissions() : DEFAULT_PERMISSIONS))
                .enabled(true)
                .healthStatus(HealthStatus.UNKNOWN)
                .build();
        App saved = appRepository.save(app);
        log.info("[Apps] Installed {} as {}", saved.getName(), saved.getSlug());

        try {
            appDockerService.pullImage(saved.getSourceType(), saved.getSourceUrl(), saved.getVersion());
        } catch (RuntimeException e) {
            log.error("[Apps] Error pulling image for {}: {}", saved.getSlug(), e.getMessage());
            saved.setContainerStatus(ContainerStatus.ERROR);
            saved.setHealthStatus(HealthStatus.UNHEALTHY);
            saved = appRepository.save(saved);
        }
        return saved;
    }

    /**
     * 更新应用配置。运行中且环境变量或端口有变化时重建容器，重建失败只记录日志。
     */
    public App updateApp(Long id, AppRequest request) {
        App app = findApp(id);
        validateEvents(request.getWebhookEvents());
        validatePermissions(request.getApiPermissions());
        validatePort(request.getInternalPort());

        boolean wasRunning = app.getContainerStatus() == ContainerStatus.RUNNING;

        if (request.getName() != null && !request.getName().isBlank()) {
            app.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            app.setDescription(emptyToNull(request.getDescription()));
        }
        if (request.getIcon() != null) {
            app.setIcon(emptyToNull(request.getIcon()));
        }
        if (request.getInternalPort() != null) {
            app.setInternalPort(request.getInternalPort());
        }
        if (request.getEnvVars() != null) {
            app.setEnvVars(toJson(request.getEnvVars()));
        }
        if (request.getWebhookEvents() != null) {
            app.setWebhookEvents(toJson(request.getWebhookEvents()));
        }
        if (request.getWebhookPath() != null && !request.getWebhookPath().isBlank()) {
            app.setWebhookPath(request.getWebhookPath());
        }
        if (request.getApiPermissions() != null) {
            app.setApiPermissions(toJson(request.getApiPermissions()));
        }
        if (request.getEnabled() != null) {
            app.setEnabled(request.getEnabled());
        }

        App saved = appRepository.save(app);

        if (wasRunning && (request.getEnvVars() != null || request.getInternalPort() != null)) {
            restartQuietly(saved, "config change");
        }
        return masked(saved);
    }

    /**
     * 卸载：先停止并删除容器，再删除记录。容器不存在视为已删除；其他运行时错误直接抛出，记录保留以便重试。
     * 投递记录保留。
     */
    public void uninstallApp(Long id) {
        App app = findApp(id);
        if (app.getContainerName() != null) {
            appDockerService.stopApp(app);
            appDockerService.removeContainer(app.getContainerName());
        }
        appRepository.delete(app);
        log.info("[Apps] Uninstalled {}", app.getSlug());
    }

    /**
     * 启动应用。已停用的应用不能启动；失败时把缓存状态标记为 error 后重新抛出。
     *
     * @return false 表示本来就在运行
     */
    public boolean startApp(Long id) {
        App app = findApp(id);
        if (!app.isEnabled()) {
            throw new ValidationException("App is disabled");
        }
        if (app.getContainerStatus() == ContainerStatus.RUNNING) {
            return false;
        }
        try {
            appDockerService.startApp(app);
        } catch (RuntimeException e) {
            markError(app);
            throw e;
        }
        app.setContainerStatus(ContainerStatus.RUNNING);
        app.setHealthStatus(HealthStatus.UNKNOWN);
        appRepository.save(app);
        return true;
    }

    /**
     * 停止应用。
     *
     * @return false 表示本来就已停止
     */
    public boolean stopApp(Long id) {
        App app = findApp(id);
        if (app.getContainerStatus() == ContainerStatus.STOPPED) {
            return false;
        }
        appDockerService.stopApp(app);
        app.setContainerStatus(ContainerStatus.STOPPED);
        appRepository.save(app);
        return true;
    }

    public void restartApp(Long id) {
        App app = findApp(id);
        if (!app.isEnabled()) {
            throw new ValidationException("App is disabled");
        }
        appDockerService.restartApp(app);
        app.setContainerStatus(ContainerStatus.RUNNING);
        app.setHealthStatus(HealthStatus.UNKNOWN);
        appRepository.save(app);
    }

    public String getLogs(Long id, int tail) {
        App app = findApp(id);
        if (app.getContainerName() == null) {
            throw new ValidationException("App has no container");
        }
        return appDockerService.getLogs(app.getContainerName(), tail > 0 ? tail : 100);
    }

    /**
     * 重新生成 API Key，运行中的应用会被重建以拿到新值。
     */
    public String regenerateApiKey(Long id) {
        App app = findApp(id);
        boolean wasRunning = app.getContainerStatus() == ContainerStatus.RUNNING;
        app.setApiKey(generateApiKey());
        App saved = appRepository.save(app);
        if (wasRunning) {
            restartQuietly(saved, "key regeneration");
        }
        return saved.getApiKey();
    }

    /**
     * 重新生成 Webhook 密钥，运行中的应用会被重建以拿到新值。
     */
    public String regenerateWebhookSecret(Long id) {
        App app = findApp(id);
        boolean wasRunning = app.getContainerStatus() == ContainerStatus.RUNNING;
        app.setWebhookSecret(generateWebhookSecret());
        App saved = appRepository.save(app);
        if (wasRunning) {
            restartQuietly(saved, "secret regeneration");
        }
        return saved.getWebhookSecret();
    }

    /**
     * 查询容器实时状态，与缓存不一致时写回。
     */
    public AppContainerStatus refreshStatus(Long id) {
        App app = findApp(id);
        if (app.getContainerName() == null) {
            return new AppContainerStatus(ContainerStatus.STOPPED, HealthStatus.UNKNOWN, false);
        }

        AppContainerStatus status = appDockerService.getContainerStatus(app.getContainerName());
        if (status.containerStatus() != app.getContainerStatus() || status.healthStatus() != app.getHealthStatus()) {
            app.setContainerStatus(status.containerStatus());
            app.setHealthStatus(status.healthStatus());
            app.setLastHealthCheck(LocalDateTime.now());
            appRepository.save(app);
        }
        return status;
    }

    public List<ContainerSummary> listContainers() {
        return appDockerService.listAppContainers();
    }

    static String generateSlug(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-|-$", "");
    }

    static String generateApiKey() {
        return API_KEY_PREFIX + randomHex(32);
    }

    static String generateWebhookSecret() {
        return randomHex(32);
    }

    /**
     * 列表与详情接口返回的脱敏副本。
     */
    static App masked(App app) {
        return app.toBuilder()
                .apiKey(app.getApiKey() != null
                        ? app.getApiKey().substring(0, Math.min(12, app.getApiKey().length())) + "..."
                        : null)
                .webhookSecret(app.getWebhookSecret() != null ? "***" : null)
                .build();
    }

    private void restartQuietly(App app, String reason) {
        try {
            appDockerService.restartApp(app);
        } catch (RuntimeException e) {
            log.error("[Apps] Error restarting {} after {}: {}", app.getSlug(), reason, e.getMessage());
        }
    }

    private void markError(App app) {
        try {
            app.setContainerStatus(ContainerStatus.ERROR);
            app.setHealthStatus(HealthStatus.UNHEALTHY);
            appRepository.save(app);
        } catch (RuntimeException e) {
            log.warn("[Apps] Could not mark {} as error: {}", app.getSlug(), e.getMessage());
        }
    }

    private static void validateEvents(List<String> events) {
        if (events == null) {
            return;
        }
        for (String event : events) {
            if (WebhookEventType.find(event).isEmpty()) {
                throw new ValidationException("Invalid webhook event: " + event);
            }
        }
    }

    private static void validatePermissions(List<String> permissions) {
        if (permissions == null) {
            return;
        }
        for (String permission : permissions) {
            if (!API_PERMISSIONS.contains(permission)) {
                throw new ValidationException("Invalid API permission: " + permission);
            }
        }
    }

    private static void validatePort(Integer port) {
        if (port != null && (port < 1 || port > 65535)) {
            throw new ValidationException("Invalid internal port: " + port);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON value: " + e.getOriginalMessage());
        }
    }

    private static String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
