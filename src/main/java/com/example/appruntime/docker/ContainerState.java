package com.example.appruntime.docker;

/**
 * inspect 结果中编排逻辑关心的部分。
 *
 * @param name    容器名
 * @param running 是否运行中
 * @param status  运行时原始状态（created, running, exited ...）
 * @param health  健康检查状态（healthy, unhealthy, starting），未配置健康检查时为 null
 */
public record ContainerState(String name, boolean running, String status, String health) {
}
