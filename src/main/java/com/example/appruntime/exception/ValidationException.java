package com.example.appruntime.exception;

/**
 * 输入非法或违反不变量（如删除当前 active 连接）。在任何修改之前抛出。
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
