package com.example.appruntime.exception;

/**
 * 外部调用失败：节点后端、容器运行时或应用 HTTP 端点。
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
