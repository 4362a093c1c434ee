package com.example.appruntime.model;

/**
 * 当前 active 连接及实时探测结果。
 */
public record ActiveConnectionStatus(BackendConnection connection, Status status) {

    public record Status(boolean connected, String nodeId, String error) {
    }
}
