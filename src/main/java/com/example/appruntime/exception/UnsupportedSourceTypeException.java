package com.example.appruntime.exception;

/**
 * 尚未实现的应用来源类型（例如从 GitHub 源码构建）。
 */
public class UnsupportedSourceTypeException extends UnsupportedOperationException {

    public UnsupportedSourceTypeException(String sourceType) {
        super("Source type '" + sourceType + "' is not implemented yet. Use docker_image instead.");
    }
}
