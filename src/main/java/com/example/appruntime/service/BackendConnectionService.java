package com.example.appruntime.service;

import com.example.appruntime.exception.ResourceNotFoundException;
import com.example.appruntime.exception.UpstreamException;
import com.example.appruntime.exception.ValidationException;
import com.example.appruntime.model.ActiveConnectionStatus;
import com.example.appruntime.model.BackendConnection;
import com.example.appruntime.model.ConnectionTestResult;
import com.example.appruntime.model.NodeInfo;
import com.example.appruntime.model.Settings;
import com.example.appruntime.repository.BackendConnectionRepository;
import com.example.appruntime.repository.NodeInfoRepository;
import com.example.appruntime.repository.SettingsRepository;
import com.example.appruntime.utils.UrlValidator;
import com.example.appruntime.websocket.NodeEventStreamSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 节点后端连接管理：维护 "恰好一个 active" 不变量，并让 {@link LiveBackendConfig} 与 active 连接保持一致。
 * <p>
 * 激活、修改 active 连接和删除都在同一把锁下进行，切换时先测试后提交，测试失败不做任何修改。
 */
@Service
@Slf4j
public class BackendConnectionService {

    static final String DOCKER_CONNECTION_NAME = "Docker (Local)";
    static final String MIGRATED_CONNECTION_NAME = "External Phoenixd (Migrated)";

    private final BackendConnectionRepository connectionRepository;
    private final SettingsRepository settingsRepository;
    private final NodeInfoRepository nodeInfoRepository;
    private final NodeBackendClient nodeClient;
    private final LiveBackendConfig liveConfig;
    private final NodeEventStreamSubscriber eventStream;
    private final UrlValidator urlValidator;
    private final TransactionTemplate transactionTemplate;

    private final ReentrantLock activationLock = new ReentrantLock();

    public BackendConnectionService(BackendConnectionRepository connectionRepository,
            SettingsRepository settingsRepository,
            NodeInfoRepository nodeInfoRepository,
            NodeBackendClient nodeClient,
            LiveBackendConfig liveConfig,
            NodeEventStreamSubscriber eventStream,
            UrlValidator urlValidator,
            PlatformTransactionManager transactionManager) {
        this.connectionRepository = connectionRepository;
        this.settingsRepository = settingsRepository;
        this.nodeInfoRepository = nodeInfoRepository;
        this.nodeClient = nodeClient;
        this.liveConfig = liveConfig;
        this.eventStream = eventStream;
        this.urlValidator = urlValidator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * 启动时调用：确保 Docker 连接存在、迁移旧版设置、保证有且只有一个 active，并同步到实时配置。
     *
     * @return 当前 active 连接
     */
    public BackendConnection bootstrap() {
        activationLock.lock();
        try {
            BackendConnection active = transactionTemplate.execute(status -> {
                BackendConnection docker = connectionRepository.findFirstByDockerTrue()
                        .orElseGet(this::createDockerConnection);

                migrateLegacySettings();

                long activeCount = connectionRepository.countByActiveTrue();
                if (activeCount == 0) {
                    connectionRepository.markActive(docker.getId());
                    log.info("[Connections] Activated Docker connection as default");
                } else if (activeCount > 1) {
                    Long keep = connectionRepository.findFirstByActiveTrue().map(BackendConnection::getId)
                            .orElse(docker.getId());
                    log.warn("[Connections] Found {} active connections, keeping #{}", activeCount, keep);
                    connectionRepository.deactivateAll();
                    connectionRepository.markActive(keep);
                }
                return connectionRepository.findFirstByActiveTrue()
                        .orElseThrow(() -> new IllegalStateException("No active connection after bootstrap"));
            });

            applyLiveConfig(active);
            log.info("[Connections] Using active connection: {} ({})", active.getName(), active.getUrl());
            return active;
        } finally {
            activationLock.unlock();
        }
    }

    /**
     * 通过当前配置探测节点并刷新节点信息缓存（应用环境变量使用）。
     */
    public void refreshNodeInfo() {
        try {
            NodeBackendClient.NodeIdentity identity = nodeClient.getInfo();
            cacheNodeInfo(identity);
        } catch (UpstreamException e) {
            log.warn("[Connections] Could not refresh node info: {}", e.getMessage());
        }
    }

    public List<BackendConnection> listConnections() {
        return connectionRepository.findAllByOrderByDockerDescCreatedAtAsc();
    }

    public BackendConnection getConnection(Long id) {
        return connectionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Connection not found"));
    }

    /**
     * active 连接及实时探测结果。探测失败不抛出，写入 status.error。
     */
    public ActiveConnectionStatus getActiveConnection() {
        BackendConnection active = connectionRepository.findFirstByActiveTrue().orElse(null);
        try {
            NodeBackendClient.NodeIdentity identity = nodeClient.getInfo();
            return new ActiveConnectionStatus(active,
                    new ActiveConnectionStatus.Status(true, identity.nodeId(), null));
        } catch (UpstreamException e) {
            return new ActiveConnectionStatus(active,
                    new ActiveConnectionStatus.Status(false, null, e.getMessage()));
        }
    }

    /**
     * 测试未保存的地址与密码。
     *
     * @throws ValidationException 地址格式非法
     */
    public ConnectionTestResult testConnection(String url, String password) {
        String normalized = validateUrl(url);
        try {
            NodeBackendClient.NodeIdentity identity = nodeClient.testConnection(normalized, nullToEmpty(password));
            return new ConnectionTestResult(true, identity.nodeId(), identity.chain(), identity.version(), null);
        } catch (UpstreamException e) {
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    /**
     * 测试已保存的连接，成功时更新缓存的节点身份。
     */
    public ConnectionTestResult testSavedConnection(Long id) {
        BackendConnection connection = getConnection(id);
        NodeBackendClient.NodeIdentity identity;
        try {
            identity = nodeClient.testConnection(connection.getUrl(), nullToEmpty(connection.getPassword()));
        } catch (UpstreamException e) {
            return ConnectionTestResult.failed(e.getMessage());
        }

        connection.setNodeId(identity.nodeId());
        connection.setChain(identity.chain());
        connection.setLastConnectedAt(LocalDateTime.now());
        connectionRepository.save(connection);
        return new ConnectionTestResult(true, identity.nodeId(), identity.chain(), identity.version(), null);
    }

    /**
     * 新建连接。保存前必须测试通过；新连接不会自动激活。
     *
     * @throws ValidationException 名称或地址非法
     * @throws UpstreamException   连接测试失败
     */
    public BackendConnection createConnection(String name, String url, String password) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Name is required");
        }
        String normalized = validateUrl(url);

        NodeBackendClient.NodeIdentity identity = nodeClient.testConnection(normalized, nullToEmpty(password));

        BackendConnection connection = BackendConnection.builder()
                .name(name.trim())
                .url(normalized)
                .password(password == null || password.isEmpty() ? null : password)
                .docker(false)
                .active(false)
                .nodeId(identity.nodeId())
                .chain(identity.chain())
                .lastConnectedAt(LocalDateTime.now())
                .build();
        BackendConnection saved = connectionRepository.save(connection);
        log.info("[Connections] Created connection #{} {} ({})", saved.getId(), saved.getName(), saved.getUrl());
        return saved;
    }

    /**
     * 修改连接。地址或密码变化时重新测试；Docker 连接只允许改名。
     * 修改的是 active 连接时同步实时配置并重连事件流。
     *
     * @param password null 表示不修改
     */
    public BackendConnection updateConnection(Long id, String name, String url, String password) {
        activationLock.lock();
        try {
            BackendConnection existing = getConnection(id);

            if (existing.isDocker() && (hasText(url) || hasText(password))) {
                throw new ValidationException("Cannot modify Docker connection URL or password");
            }

            String newUrl = hasText(url) ? validateUrl(url) : existing.getUrl();
            String newPassword = password != null ? password : existing.getPassword();

            boolean credentialsChanged = !newUrl.equals(existing.getUrl())
                    || (password != null && !Objects.equals(password, nullToEmpty(existing.getPassword())));

            if (credentialsChanged) {
                NodeBackendClient.NodeIdentity identity = nodeClient.testConnection(newUrl, nullToEmpty(newPassword));
                existing.setNodeId(identity.nodeId());
                existing.setChain(identity.chain());
                existing.setLastConnectedAt(LocalDateTime.now());
            }

            if (hasText(name)) {
                existing.setName(name.trim());
            }
            if (!existing.isDocker()) {
                existing.setUrl(newUrl);
                existing.setPassword(newPassword == null || newPassword.isEmpty() ? null : newPassword);
            }

            BackendConnection saved = connectionRepository.save(existing);

            if (saved.isActive()) {
                applyLiveConfig(saved);
                reconnectEventStream();
            }
            return saved;
        } finally {
            activationLock.unlock();
        }
    }

    /**
     * 切换 active 连接。测试失败时不做任何修改；成功后在一个事务内完成切换，然后同步实时配置并重连事件流。
     *
     * @throws UpstreamException 连接测试失败
     */
    public BackendConnection activateConnection(Long id) {
        activationLock.lock();
        try {
            BackendConnection connection = getConnection(id);

            NodeBackendClient.NodeIdentity identity;
            try {
                identity = nodeClient.testConnection(connection.getUrl(), nullToEmpty(connection.getPassword()));
            } catch (UpstreamException e) {
                throw new UpstreamException("Cannot activate: " + e.getMessage(), e);
            }

            transactionTemplate.executeWithoutResult(status -> {
                connection.setNodeId(identity.nodeId());
                connection.setChain(identity.chain());
                connection.setLastConnectedAt(LocalDateTime.now());
                connectionRepository.save(connection);
                connectionRepository.deactivateAll();
                connectionRepository.markActive(connection.getId());
            });
            connection.setActive(true);

            applyLiveConfig(connection);
            cacheNodeInfo(identity);
            reconnectEventStream();

            log.info("[Connections] Switched to {} ({})", connection.getName(), connection.getUrl());
            return connection;
        } finally {
            activationLock.unlock();
        }
    }

    /**
     * 删除连接。Docker 连接和 active 连接不可删除。
     */
    public void deleteConnection(Long id) {
        activationLock.lock();
        try {
            BackendConnection existing = getConnection(id);
            if (existing.isDocker()) {
                throw new ValidationException("Cannot delete the Docker connection");
            }
            if (existing.isActive()) {
                throw new ValidationException(
                        "Cannot delete the active connection. Switch to another connection first.");
            }
            connectionRepository.delete(existing);
            log.info("[Connections] Deleted connection #{} {}", id, existing.getName());
        } finally {
            activationLock.unlock();
        }
    }

    private BackendConnection createDockerConnection() {
        log.info("[Connections] Creating default Docker connection");
        return connectionRepository.save(BackendConnection.builder()
                .name(DOCKER_CONNECTION_NAME)
                .url(liveConfig.getDefaultUrl())
                .password(liveConfig.getDefaultPassword())
                .docker(true)
                .active(false)
                .build());
    }

    /**
     * 旧版单连接设置：外部节点地址尚未成为连接时，迁移为一条 active 连接。
     */
    private void migrateLegacySettings() {
        Optional<Settings> settings = settingsRepository.findById(NodeInfo.SINGLETON_ID);
        if (settings.isEmpty() || !settings.get().isUseExternalPhoenixd() || !hasText(settings.get().getPhoenixdUrl())) {
            return;
        }

        String legacyUrl = settings.get().getPhoenixdUrl();
        if (connectionRepository.findFirstByUrl(legacyUrl).isPresent()) {
            return;
        }

        log.info("[Connections] Migrating external phoenixd configuration from settings");
        connectionRepository.deactivateAll();
        connectionRepository.save(BackendConnection.builder()
                .name(MIGRATED_CONNECTION_NAME)
                .url(legacyUrl)
                .password(settings.get().getPhoenixdPassword())
                .docker(false)
                .active(true)
                .build());
    }

    private void applyLiveConfig(BackendConnection connection) {
        liveConfig.apply(connection.getUrl(), nullToEmpty(connection.getPassword()), !connection.isDocker());
    }

    private void reconnectEventStream() {
        try {
            eventStream.reconnect();
        } catch (RuntimeException e) {
            // 重连失败由事件流自身的定时重连兜底
            log.warn("[Connections] Event stream reconnect failed: {}", e.getMessage());
        }
    }

    private void cacheNodeInfo(NodeBackendClient.NodeIdentity identity) {
        try {
            nodeInfoRepository.save(NodeInfo.builder()
                    .nodeId(identity.nodeId())
                    .chain(identity.chain())
                    .updatedAt(LocalDateTime.now())
                    .build());
        } catch (RuntimeException e) {
            log.error("[Connections] Failed to cache node info", e);
        }
    }

    private String validateUrl(String url) {
        try {
            return urlValidator.validate(url);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
