package com.example.appruntime.service;

import com.example.appruntime.exception.WebhookDeliveryException;
import com.example.appruntime.model.App;
import com.example.appruntime.model.ContainerStatus;
import com.example.appruntime.model.DispatchSummary;
import com.example.appruntime.model.WebhookDeliveryResult;
import com.example.appruntime.model.WebhookEventData;
import com.example.appruntime.model.WebhookEventType;
import com.example.appruntime.model.WebhookLog;
import com.example.appruntime.model.WebhookStats;
import com.example.appruntime.repository.AppRepository;
import com.example.appruntime.repository.OffsetPageRequest;
import com.example.appruntime.repository.WebhookLogRepository;
import com.example.appruntime.security.WebhookSigner;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 节点事件的 Webhook 分发：按订阅筛选应用、并发投递、签名、记录每一次尝试。
 * <p>
 * 投递语义为至多一次，不重试。
 */
@Service
@Slf4j
public class WebhookDispatchService {

    public static final String EVENT_HEADER = "X-Webhook-Event";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String APP_ID_HEADER = "X-App-Id";

    static final int RESPONSE_LIMIT = 500;
    static final int RETENTION_DAYS = 30;
    static final String DELIVERY_METRIC = "app.webhook.delivery";
    // 投递本身受 timeout 约束，排队等待另计余量
    static final Duration DELIVERY_GRACE = Duration.ofSeconds(2);

    private final AppRepository appRepository;
    private final WebhookLogRepository webhookLogRepository;
    private final AppDockerService appDockerService;
    private final WebhookSigner signer;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Executor executor;
    private final Duration timeout;
    private final HttpClient httpClient;

    public WebhookDispatchService(AppRepository appRepository,
            WebhookLogRepository webhookLogRepository,
            AppDockerService appDockerService,
            WebhookSigner signer,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Qualifier("webhookExecutor") Executor executor,
            @Value("${app.webhook.timeout:10s}") Duration timeout) {
        this.appRepository = appRepository;
        this.webhookLogRepository = webhookLogRepository;
        this.appDockerService = appDockerService;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.executor = executor;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    /**
     * 向所有订阅了该事件、已启用且运行中的应用投递 Webhook。
     * <p>
     * 所有投递完成（成功、失败或超时）后才返回，最长等待 timeout 加 {@link #DELIVERY_GRACE}；
     * 任何单个应用的失败都不会抛给调用方。
     *
     * @param eventType 事件类型
     * @param data      事件数据
     * @return 本次分发的汇总
     */
    public DispatchSummary dispatchWebhook(String eventType, Object data) {
        List<App> targets;
        try {
            targets = appRepository.findByEnabledTrueAndContainerStatus(ContainerStatus.RUNNING).stream()
                    .filter(app -> isSubscribed(app, eventType))
                    .toList();
        } catch (RuntimeException e) {
            log.error("[Webhook] Failed to load subscribers for {}", eventType, e);
            return new DispatchSummary(eventType, 0, 0);
        }

        if (targets.isEmpty()) {
            log.debug("[Webhook] No apps subscribed to {}", eventType);
            return new DispatchSummary(eventType, 0, 0);
        }

        log.info("[Webhook] Dispatching {} to {} apps", eventType, targets.size());
        AtomicInteger succeeded = new AtomicInteger();
        long deadlineMillis = timeout.plus(DELIVERY_GRACE).toMillis();

        CompletableFuture<?>[] deliveries = targets.stream()
                .map(app -> CompletableFuture
                        .runAsync(() -> {
                            sendWebhookToApp(app, eventType, data);
                            succeeded.incrementAndGet();
                        }, executor)
                        .orTimeout(deadlineMillis, TimeUnit.MILLISECONDS)
                        .exceptionally(e -> {
                            log.error("[Webhook] Failed to send {} to {}: {}", eventType, app.getSlug(),
                                    rootMessage(e));
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);

        CompletableFuture.allOf(deliveries).join();
        return new DispatchSummary(eventType, targets.size(), succeeded.get());
    }

    public DispatchSummary dispatchPaymentReceived(WebhookEventData.PaymentReceived payment) {
        return dispatchWebhook(WebhookEventType.PAYMENT_RECEIVED.getValue(), payment);
    }

    public DispatchSummary dispatchPaymentSent(WebhookEventData.PaymentSent payment) {
        return dispatchWebhook(WebhookEventType.PAYMENT_SENT.getValue(), payment);
    }

    public DispatchSummary dispatchChannelOpened(WebhookEventData.ChannelEvent channel) {
        return dispatchWebhook(WebhookEventType.CHANNEL_OPENED.getValue(), channel);
    }

    public DispatchSummary dispatchChannelClosed(WebhookEventData.ChannelEvent channel) {
        return dispatchWebhook(WebhookEventType.CHANNEL_CLOSED.getValue(), channel);
    }

    /**
     * 向单个应用投递一次，并写入一条投递记录。
     *
     * @throws WebhookDeliveryException 非 2xx、超时或网络错误
     */
    public WebhookDeliveryResult sendWebhookToApp(App app, String eventType, Object data) {
        WebhookDeliveryResult result = deliver(app, eventType, data);
        if (!result.success()) {
            throw new WebhookDeliveryException(result.statusCode(), result.error());
        }
        return result;
    }

    /**
     * 最近 100 次投递的统计。
     */
    public WebhookStats getWebhookStats(Long appId) {
        List<WebhookLog> logs = webhookLogRepository.findTop100ByAppIdOrderByCreatedAtDesc(appId);
        if (logs.isEmpty()) {
            return WebhookStats.empty();
        }

        int successful = (int) logs.stream().filter(WebhookLog::isSuccess).count();
        long latencySum = logs.stream()
                .map(WebhookLog::getLatencyMs)
                .filter(latency -> latency != null)
                .mapToLong(Long::longValue)
                .sum();
        long avgLatency = Math.round((double) latencySum / logs.size());

        return new WebhookStats(logs.size(), successful, logs.size() - successful, avgLatency,
                logs.get(0).getCreatedAt());
    }

    /**
     * 分页查询投递记录，按时间倒序。
     */
    public List<WebhookLog> getWebhookLogs(Long appId, int limit, int offset) {
        int size = Math.max(1, Math.min(limit, 500));
        return webhookLogRepository.findByAppIdOrderByCreatedAtDesc(appId,
                new OffsetPageRequest(Math.max(0, offset), size));
    }

    /**
     * 发送 test 事件，不受订阅列表限制。应用不存在或未运行时直接返回失败，不发起请求。
     */
    public WebhookDeliveryResult testWebhook(Long appId) {
        Optional<App> found = appRepository.findById(appId);
        if (found.isEmpty()) {
            return WebhookDeliveryResult.rejected("App not found");
        }
        App app = found.get();
        if (app.getContainerStatus() != ContainerStatus.RUNNING) {
            return WebhookDeliveryResult.rejected("App is not running");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "This is a test webhook from Phoenixd Dashboard");
        data.put("appId", app.getId());
        data.put("appName", app.getName());
        return deliver(app, WebhookEventType.TEST_EVENT, data);
    }

    /**
     * 删除 30 天前的投递记录。
     *
     * @return 删除条数
     */
    @Transactional
    public int cleanupOldWebhookLogs() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(RETENTION_DAYS);
        int deleted = webhookLogRepository.deleteByCreatedAtBefore(cutoff);
        log.info("[Cleanup] Deleted {} webhook logs older than {} days", deleted, RETENTION_DAYS);
        return deleted;
    }

    /**
     * 订阅列表解析失败时视为未订阅。
     */
    boolean isSubscribed(App app, String eventType) {
        String raw = app.getWebhookEvents();
        if (raw == null || raw.isBlank()) {
            return false;
        }
        try {
            List<String> events = objectMapper.readValue(raw, new TypeReference<List<String>>() {
            });
            return events != null && events.contains(eventType);
        } catch (Exception e) {
            log.warn("[Webhook] Invalid webhookEvents for {}: {}", app.getSlug(), e.getMessage());
            return false;
        }
    }

    private WebhookDeliveryResult deliver(App app, String eventType, Object data) {
        long startNanos = System.nanoTime();
        long timestamp = System.currentTimeMillis();
        Integer statusCode = null;
        String responseText = null;
        String payloadJson = null;
        boolean success = false;

        CompletableFuture<HttpResponse<String>> pending = null;
        try {
            payloadJson = objectMapper.writeValueAsString(data == null ? Collections.emptyMap() : data);

            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("event", eventType);
            envelope.put("timestamp", timestamp);
            envelope.put("data", data == null ? Collections.emptyMap() : data);
            // 签名与发送使用同一份字节
            byte[] body = objectMapper.writeValueAsBytes(envelope);

            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl(app)))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header(EVENT_HEADER, eventType)
                    .header(TIMESTAMP_HEADER, String.valueOf(timestamp))
                    .header(APP_ID_HEADER, app.getSlug())
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body));

            if (app.getWebhookSecret() != null && !app.getWebhookSecret().isEmpty()) {
                builder.header(WebhookSigner.SIGNATURE_HEADER, signer.sign(body, app.getWebhookSecret()));
            }

            pending = httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

            statusCode = response.statusCode();
            success = statusCode >= 200 && statusCode < 300;
            responseText = truncate(response.body());
        } catch (TimeoutException e) {
            pending.cancel(true);
            responseText = timeoutMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            responseText = "Interrupted";
        } catch (Exception e) {
            responseText = rootCause(e) instanceof HttpTimeoutException ? timeoutMessage() : truncate(rootMessage(e));
        }

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        recordLog(app, eventType, payloadJson, statusCode, responseText, success, latencyMs);
        Timer.builder(DELIVERY_METRIC)
                .tag("event", eventType)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(Duration.ofMillis(latencyMs));

        if (success) {
            log.info("[Webhook] {} -> {} HTTP {} ({}ms)", eventType, app.getSlug(), statusCode, latencyMs);
            return new WebhookDeliveryResult(true, statusCode, latencyMs, null);
        }

        String error = statusCode != null ? "HTTP " + statusCode + ": " + nullToEmpty(responseText) : responseText;
        log.warn("[Webhook] {} -> {} failed ({}ms): {}", eventType, app.getSlug(), latencyMs, error);
        return new WebhookDeliveryResult(false, statusCode, latencyMs, error);
    }

    private void recordLog(App app, String eventType, String payload, Integer statusCode, String response,
            boolean success, long latencyMs) {
        try {
            webhookLogRepository.save(WebhookLog.builder()
                    .appId(app.getId())
                    .eventType(eventType)
                    .payload(payload)
                    .statusCode(statusCode)
                    .response(response)
                    .success(success)
                    .latencyMs(latencyMs)
                    .build());
        } catch (RuntimeException e) {
            log.error("[Webhook] Failed to save webhook log for {}", app.getSlug(), e);
        }
    }

    private String webhookUrl(App app) {
        String path = app.getWebhookPath();
        if (path == null || path.isBlank()) {
            path = "/webhook";
        } else if (!path.startsWith("/")) {
            path = "/" + path;
        }
        return appDockerService.getAppInternalUrl(app) + path;
    }

    static String truncate(String text) {
        if (text == null || text.length() <= RESPONSE_LIMIT) {
            return text;
        }
        return text.substring(0, RESPONSE_LIMIT);
    }

    private String timeoutMessage() {
        return "Timed out after " + timeout.toMillis() + "ms";
    }

    private static Throwable rootCause(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = rootCause(e);
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
