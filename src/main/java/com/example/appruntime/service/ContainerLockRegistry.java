package com.example.appruntime.service;

import com.example.appruntime.docker.ContainerRuntimeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按容器名串行化生命周期操作；不同容器互不阻塞。
 */
@Component
@Slf4j
public class ContainerLockRegistry {

    // 键：容器名；锁对象随应用数量增长，不做回收
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final Duration acquireTimeout;

    public ContainerLockRegistry(@Value("${app.lifecycle.lock-timeout:2m}") Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public <T> T withLock(String containerName, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(containerName, key -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerRuntimeException("Interrupted waiting for lock on " + containerName, e);
        }

        if (!acquired) {
            log.warn("[Lifecycle] Timed out waiting {} for container lock {}", acquireTimeout, containerName);
            throw new ContainerRuntimeException("Another operation on " + containerName + " is still in progress");
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String containerName, Runnable action) {
        withLock(containerName, () -> {
            action.run();
            return null;
        });
    }
}
