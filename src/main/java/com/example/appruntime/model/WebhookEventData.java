package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 各事件类型的 data 字段结构。
 */
public final class WebhookEventData {

    private WebhookEventData() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PaymentReceived(String paymentHash, long amountSat, String description, String externalId,
            long receivedAt, String payerKey, String payerNote) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PaymentSent(String paymentId, String paymentHash, long amountSat, long feesSat,
            String destination, long sentAt) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChannelEvent(String channelId, long capacitySat, String fundingTxId, long timestamp) {
    }
}
