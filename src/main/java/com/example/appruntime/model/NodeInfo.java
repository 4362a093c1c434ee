package com.example.appruntime.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 节点信息缓存（单例行）。
 */
@Entity
@Table(name = "node_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInfo {

    public static final String SINGLETON_ID = "singleton";

    @Id
    @Builder.Default
    private String id = SINGLETON_ID;

    private String nodeId;

    private String chain;

    private LocalDateTime updatedAt;
}
