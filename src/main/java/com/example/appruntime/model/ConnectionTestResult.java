package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 连接测试结果。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionTestResult(boolean success, String nodeId, String chain, String version, String error) {

    public static ConnectionTestResult failed(String error) {
        return new ConnectionTestResult(false, null, null, null, error);
    }
}
