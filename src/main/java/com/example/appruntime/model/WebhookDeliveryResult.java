package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 单次投递结果。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookDeliveryResult(boolean success, Integer statusCode, long latencyMs, String error) {

    public static WebhookDeliveryResult rejected(String error) {
        return new WebhookDeliveryResult(false, null, 0, error);
    }
}
