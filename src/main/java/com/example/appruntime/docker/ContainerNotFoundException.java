package com.example.appruntime.docker;

/**
 * 容器不存在。调用方可将其视为合法的 "absent" 状态。
 */
public class ContainerNotFoundException extends ContainerRuntimeException {

    public ContainerNotFoundException(String containerName) {
        super("Container not found: " + containerName);
    }
}
