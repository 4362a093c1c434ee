package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 应用可订阅的 Webhook 事件类型。
 */
public enum WebhookEventType {
    PAYMENT_RECEIVED("payment_received"),
    PAYMENT_SENT("payment_sent"),
    CHANNEL_OPENED("channel_opened"),
    CHANNEL_CLOSED("channel_closed");

    /**
     * 测试投递使用的合成事件名，不可订阅。
     */
    public static final String TEST_EVENT = "test";

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<WebhookEventType> find(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(WebhookEventType::getValue).toList();
    }
}
