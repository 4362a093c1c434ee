package com.example.appruntime.docker;

import lombok.Builder;
import lombok.Singular;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 创建容器所需的规格。
 */
@Builder
public record ContainerSpec(
        String name,
        String image,
        List<String> env,
        @Singular Map<String, String> labels,
        String network,
        long memoryBytes,
        long nanoCpus,
        String restartPolicy,
        List<String> healthcheckTest,
        Duration healthcheckInterval,
        Duration healthcheckTimeout,
        int healthcheckRetries,
        Duration healthcheckStartPeriod) {
}
