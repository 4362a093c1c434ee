package com.example.appruntime.config;

import com.example.appruntime.service.BackendConnectionService;
import com.example.appruntime.websocket.NodeEventStreamSubscriber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时初始化节点连接：确保 Docker 默认连接存在、迁移旧设置、同步实时配置，然后订阅事件流。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConnectionInitializer implements CommandLineRunner {

    private final BackendConnectionService connectionService;
    private final NodeEventStreamSubscriber eventStream;

    @Value("${app.phoenixd.event-stream.enabled:true}")
    private boolean eventStreamEnabled = true;

    @Override
    public void run(String... args) {
        try {
            connectionService.bootstrap();
        } catch (RuntimeException e) {
            // 使用默认配置继续启动，连接可稍后在管理接口中修复
            log.error("[Connections] Error initializing connections", e);
        }

        connectionService.refreshNodeInfo();

        if (eventStreamEnabled) {
            eventStream.connect();
        } else {
            log.info("[EventStream] Node event stream disabled");
        }
    }
}
