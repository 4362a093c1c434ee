package com.example.appruntime.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Webhook 投递记录。只追加，不修改；appId 不设外键，应用卸载后记录仍保留用于审计。
 */
@Entity
@Table(name = "app_webhook_log", indexes = {
        @Index(name = "idx_webhook_log_app_id", columnList = "appId"),
        @Index(name = "idx_webhook_log_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long appId;

    @Column(nullable = false, updatable = false)
    private String eventType;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Column(updatable = false)
    private Integer statusCode;

    @Column(length = 500, updatable = false)
    private String response;

    @Column(updatable = false)
    private boolean success;

    @Column(updatable = false)
    private Long latencyMs;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
