package com.example.appruntime.websocket;

import com.example.appruntime.model.WebhookEventData;
import com.example.appruntime.model.WebhookEventType;
import com.example.appruntime.service.LiveBackendConfig;
import com.example.appruntime.service.WebhookDispatchService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * 订阅节点事件流（phoenixd /websocket），收到入账事件后异步分发 Webhook。
 * <p>
 * 连接断开后按固定间隔重连；主动调用 {@link #reconnect()} 关闭的旧连接不会触发自动重连。
 */
@Component
@Slf4j
public class NodeEventStreamSubscriber extends TextWebSocketHandler {

    private final LiveBackendConfig liveConfig;
    private final WebhookDispatchService dispatchService;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final Duration reconnectDelay;
    private final WebSocketClient client = new StandardWebSocketClient();

    private final Object monitor = new Object();
    // 每次 connect 递增，回调据此识别过期的连接
    private long generation;
    private boolean stopped;
    private WebSocketSession session;
    private ScheduledFuture<?> pendingReconnect;

    public NodeEventStreamSubscriber(LiveBackendConfig liveConfig,
            WebhookDispatchService dispatchService,
            ObjectMapper objectMapper,
            @Qualifier("taskExecutor") Executor executor,
            @Qualifier("taskScheduler") TaskScheduler scheduler,
            @Value("${app.phoenixd.reconnect-delay:5s}") Duration reconnectDelay) {
        this.liveConfig = liveConfig;
        this.dispatchService = dispatchService;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.scheduler = scheduler;
        this.reconnectDelay = reconnectDelay;
    }

    /**
     * 按当前 active 配置建立连接。已有连接会先被关闭，挂起的重连会被取消。
     */
    public void connect() {
        long currentGeneration;
        WebSocketSession previous;
        synchronized (monitor) {
            cancelPendingReconnect();
            generation++;
            currentGeneration = generation;
            previous = session;
            session = null;
            stopped = false;
        }
        closeQuietly(previous);

        LiveBackendConfig.Target target = liveConfig.current();
        String url = liveConfig.getWebSocketUrl();
        log.info("[EventStream] Connecting to {} ({})", url, target.external() ? "external" : "docker");

        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        String credentials = ":" + (target.password() == null ? "" : target.password());
        headers.set("Authorization",
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));

        CompletableFuture<WebSocketSession> handshake;
        try {
            handshake = client.execute(this, headers, URI.create(url));
        } catch (RuntimeException e) {
            log.warn("[EventStream] Cannot connect to {}: {}", url, e.getMessage());
            scheduleReconnect(currentGeneration);
            return;
        }

        handshake.whenComplete((opened, ex) -> {
            if (ex != null) {
                log.warn("[EventStream] Handshake with {} failed: {}", url, ex.getMessage());
                scheduleReconnect(currentGeneration);
                return;
            }
            boolean stale;
            synchronized (monitor) {
                stale = currentGeneration != generation || stopped;
                if (!stale && opened.isOpen()) {
                    session = opened;
                }
            }
            if (stale) {
                closeQuietly(opened);
            } else if (!opened.isOpen()) {
                // 握手完成前已被对端关闭
                scheduleReconnect(currentGeneration);
            }
        });
    }

    /**
     * 切换节点后调用：关闭旧连接并立即按新配置重连。
     */
    public void reconnect() {
        log.info("[EventStream] Reconnecting after backend change");
        connect();
    }

    public boolean isConnected() {
        synchronized (monitor) {
            return session != null && session.isOpen();
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("[EventStream] Connected to node event stream (Session ID: {})", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        handleEvent(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[EventStream] Transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
        long currentGeneration;
        synchronized (monitor) {
            if (session != closed) {
                // reconnect() 主动关闭的旧连接
                return;
            }
            session = null;
            currentGeneration = generation;
        }
        log.info("[EventStream] Disconnected ({}), retrying in {}s", status, reconnectDelay.toSeconds());
        scheduleReconnect(currentGeneration);
    }

    /**
     * 处理一条事件。无法解析的消息记录后丢弃。
     */
    void handleEvent(String payload) {
        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("[EventStream] Dropping malformed event: {}", e.getOriginalMessage());
            return;
        }
        if (event == null || !event.isObject()) {
            log.warn("[EventStream] Dropping non-object event");
            return;
        }

        String type = event.path("type").asText("");
        log.debug("[EventStream] Received {} event", type);

        if (WebhookEventType.PAYMENT_RECEIVED.getValue().equals(type)) {
            WebhookEventData.PaymentReceived payment = new WebhookEventData.PaymentReceived(
                    event.path("paymentHash").asText(""),
                    event.path("amountSat").asLong(0),
                    textOrNull(event, "description"),
                    textOrNull(event, "externalId"),
                    System.currentTimeMillis(),
                    textOrNull(event, "payerKey"),
                    textOrNull(event, "payerNote"));

            CompletableFuture
                    .runAsync(() -> dispatchService.dispatchPaymentReceived(payment), executor)
                    .exceptionally(e -> {
                        log.error("[EventStream] Error dispatching payment webhook", e);
                        return null;
                    });
        }
    }

    @PreDestroy
    public void shutdown() {
        WebSocketSession current;
        synchronized (monitor) {
            stopped = true;
            cancelPendingReconnect();
            current = session;
            session = null;
        }
        closeQuietly(current);
    }

    private void scheduleReconnect(long expectedGeneration) {
        synchronized (monitor) {
            if (stopped || expectedGeneration != generation) {
                return;
            }
            cancelPendingReconnect();
            pendingReconnect = scheduler.schedule(this::connect, Instant.now().plus(reconnectDelay));
        }
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void closeQuietly(WebSocketSession target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("[EventStream] Error closing session {}: {}", target.getId(), e.getMessage());
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
