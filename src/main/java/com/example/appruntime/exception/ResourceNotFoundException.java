package com.example.appruntime.exception;

/**
 * 应用或连接记录不存在。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
