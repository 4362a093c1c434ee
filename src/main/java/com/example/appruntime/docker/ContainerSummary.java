package com.example.appruntime.docker;

import java.util.Map;

/**
 * 容器列表条目。
 */
public record ContainerSummary(String id, String name, String state, Map<String, String> labels) {
}
