package com.example.appruntime.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 全局设置（单例行）。这里只关心旧版单连接配置字段，用于一次性迁移。
 */
@Entity
@Table(name = "settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Settings {

    @Id
    @Builder.Default
    private String id = NodeInfo.SINGLETON_ID;

    @Builder.Default
    private boolean useExternalPhoenixd = false;

    private String phoenixdUrl;

    private String phoenixdPassword;
}
