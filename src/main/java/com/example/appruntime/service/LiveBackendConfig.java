package com.example.appruntime.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 当前使用的节点后端配置（进程级，不持久化）。
 * <p>
 * 只由 {@link BackendConnectionService} 修改，始终与 active 连接保持一致。
 */
@Component
@Slf4j
public class LiveBackendConfig {

    /**
     * 一次完整的配置快照，整体替换保证读者看不到半更新状态。
     */
    public record Target(String url, String password, boolean external) {
    }

    private final String defaultUrl;
    private final String defaultPassword;
    private final AtomicReference<Target> current;

    public LiveBackendConfig(@Value("${app.phoenixd.url:http://phoenixd:9740}") String defaultUrl,
            @Value("${app.phoenixd.password:}") String defaultPassword) {
        this.defaultUrl = defaultUrl;
        this.defaultPassword = defaultPassword;
        this.current = new AtomicReference<>(new Target(defaultUrl, defaultPassword, false));
    }

    public Target current() {
        return current.get();
    }

    public String getUrl() {
        return current.get().url();
    }

    public boolean isExternal() {
        return current.get().external();
    }

    /**
     * 事件流 WebSocket 地址：http(s) 换成 ws(s)。
     */
    public String getWebSocketUrl() {
        return getUrl().replaceFirst("^http", "ws") + "/websocket";
    }

    String getDefaultUrl() {
        return defaultUrl;
    }

    String getDefaultPassword() {
        return defaultPassword;
    }

    void apply(String url, String password, boolean external) {
        Target target = new Target(
                url == null || url.isEmpty() ? defaultUrl : url,
                password == null || password.isEmpty() ? defaultPassword : password,
                external);
        current.set(target);
        log.info("Backend config updated: {} at {}", external ? "external" : "docker", target.url());
    }
}
