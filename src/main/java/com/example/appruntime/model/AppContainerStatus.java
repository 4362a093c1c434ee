package com.example.appruntime.model;

/**
 * 容器实时状态快照。
 */
public record AppContainerStatus(ContainerStatus containerStatus, HealthStatus healthStatus, boolean running) {

    public static AppContainerStatus notFound() {
        return new AppContainerStatus(ContainerStatus.NOT_FOUND, HealthStatus.UNKNOWN, false);
    }

    public static AppContainerStatus error() {
        return new AppContainerStatus(ContainerStatus.ERROR, HealthStatus.UNHEALTHY, false);
    }
}
