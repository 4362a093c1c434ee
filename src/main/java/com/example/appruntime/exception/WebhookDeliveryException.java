package com.example.appruntime.exception;

import lombok.Getter;

/**
 * 单个应用的 Webhook 投递失败。只在扇出层内部传递，不会抛给事件源。
 */
@Getter
public class WebhookDeliveryException extends RuntimeException {

    private final Integer statusCode;

    public WebhookDeliveryException(Integer statusCode, String message) {
        super(statusCode != null ? "Webhook failed with status " + statusCode + ": " + message
                : "Webhook failed: " + message);
        this.statusCode = statusCode;
    }
}
