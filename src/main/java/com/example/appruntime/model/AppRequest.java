package com.example.appruntime.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 安装 / 更新应用的请求体。更新时 null 字段表示不修改。
 */
@Data
public class AppRequest {

    private String name;

    private String description;

    private String icon;

    private String sourceType;

    private String sourceUrl;

    private String version;

    private Map<String, Object> envVars;

    private List<String> webhookEvents;

    private String webhookPath;

    private List<String> apiPermissions;

    private Integer internalPort;

    private Boolean enabled;
}
