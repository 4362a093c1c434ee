package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 节点后端（phoenixd）连接配置。任意时刻只有一个 active。
 */
@Entity
@Table(name = "phoenixd_connection")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackendConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String url;

    @JsonIgnore
    @ToString.Exclude
    private String password;

    // 本地 Docker 内置连接：url/password 不可修改，不可删除
    @Builder.Default
    private boolean docker = false;

    @Builder.Default
    private boolean active = false;

    private String nodeId;

    private String chain;

    private LocalDateTime lastConnectedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
