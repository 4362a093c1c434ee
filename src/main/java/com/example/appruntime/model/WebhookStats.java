package com.example.appruntime.model;

import java.time.LocalDateTime;

/**
 * 最近 100 次投递的统计。
 */
public record WebhookStats(int total, int successful, int failed, long avgLatencyMs, LocalDateTime lastWebhook) {

    public static WebhookStats empty() {
        return new WebhookStats(0, 0, 0, 0, null);
    }
}
