package com.example.appruntime.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 已安装的插件应用（以容器运行）。
 */
@Entity
@Table(name = "app")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class App {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String slug;

    @Column(columnDefinition = "TEXT")
    private String description;

    private String icon;

    @Column(nullable = false)
    private String sourceType; // docker_image, github, marketplace

    @Column(nullable = false)
    private String sourceUrl;

    @Builder.Default
    private String version = "latest";

    @Column(unique = true)
    private String containerName;

    @Builder.Default
    @Convert(converter = ContainerStatus.JpaConverter.class)
    private ContainerStatus containerStatus = ContainerStatus.STOPPED;

    @Builder.Default
    private Integer internalPort = 3000;

    @Column(columnDefinition = "TEXT")
    private String envVars; // JSON 对象，例如 {"GOAL":"1000"}

    @Column(columnDefinition = "TEXT")
    private String webhookEvents; // JSON 数组，例如 ["payment_received"]

    private String webhookSecret;

    @Builder.Default
    private String webhookPath = "/webhook";

    private String apiKey;

    @Column(columnDefinition = "TEXT")
    private String apiPermissions; // JSON 数组

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    @Convert(converter = HealthStatus.JpaConverter.class)
    private HealthStatus healthStatus = HealthStatus.UNKNOWN;

    private LocalDateTime lastHealthCheck;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
