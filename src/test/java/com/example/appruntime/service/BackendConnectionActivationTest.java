package com.example.appruntime.service;

import com.example.appruntime.model.BackendConnection;
import com.example.appruntime.repository.BackendConnectionRepository;
import com.example.appruntime.repository.NodeInfoRepository;
import com.example.appruntime.repository.SettingsRepository;
import com.example.appruntime.utils.UrlValidator;
import com.example.appruntime.websocket.NodeEventStreamSubscriber;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 并发切换连接：探测、切换、同步实时配置、重连作为一个整体执行，不交错。
 */
class BackendConnectionActivationTest {

    private static final String URL_A = "https://a.example.com";
    private static final String URL_B = "https://b.example.com";

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final Set<Long> activeIds = ConcurrentHashMap.newKeySet();
    private final CountDownLatch probingA = new CountDownLatch(1);
    private final CountDownLatch releaseA = new CountDownLatch(1);
    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    private NodeBackendClient nodeClient;
    private LiveBackendConfig liveConfig;
    private BackendConnectionService service;

    @BeforeEach
    void setUp() {
        BackendConnectionRepository repository = mock(BackendConnectionRepository.class);
        when(repository.findById(1L)).thenReturn(Optional.of(connection(1L, "A", URL_A)));
        when(repository.findById(2L)).thenReturn(Optional.of(connection(2L, "B", URL_B)));
        when(repository.save(any(BackendConnection.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(repository.deactivateAll()).thenAnswer(invocation -> {
            events.add("deactivate");
            activeIds.clear();
            return 1;
        });
        when(repository.markActive(anyLong())).thenAnswer(invocation -> {
            Long id = invocation.getArgument(0);
            events.add("mark " + id);
            activeIds.add(id);
            return 1;
        });

        nodeClient = mock(NodeBackendClient.class);
        when(nodeClient.testConnection(anyString(), anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            events.add("probe " + url);
            if (URL_A.equals(url)) {
                probingA.countDown();
                releaseA.await(5, TimeUnit.SECONDS);
            }
            return new NodeBackendClient.NodeIdentity("node-" + url, "mainnet", "0.4.0");
        });

        liveConfig = new LiveBackendConfig("http://phoenixd:9740", "docker-secret");

        NodeEventStreamSubscriber eventStream = mock(NodeEventStreamSubscriber.class);
        doAnswer(invocation -> {
            events.add("reconnect " + liveConfig.getUrl());
            return null;
        }).when(eventStream).reconnect();

        service = new BackendConnectionService(repository, mock(SettingsRepository.class),
                mock(NodeInfoRepository.class), nodeClient, liveConfig, eventStream, mock(UrlValidator.class),
                mock(PlatformTransactionManager.class));
    }

    @AfterEach
    void tearDown() {
        releaseA.countDown();
        executor.shutdownNow();
    }

    @Test
    void testConcurrentActivationsDoNotInterleave() throws Exception {
        CompletableFuture<BackendConnection> first =
                CompletableFuture.supplyAsync(() -> service.activateConnection(1L), executor);
        assertTrue(probingA.await(5, TimeUnit.SECONDS));

        CompletableFuture<BackendConnection> second =
                CompletableFuture.supplyAsync(() -> service.activateConnection(2L), executor);

        // A 的探测未结束前，B 不能开始探测
        verify(nodeClient, after(300).times(1)).testConnection(anyString(), anyString());
        assertFalse(second.isDone());

        releaseA.countDown();
        assertEquals("A", first.get(5, TimeUnit.SECONDS).getName());
        assertEquals("B", second.get(5, TimeUnit.SECONDS).getName());

        assertEquals(List.of(
                "probe " + URL_A, "deactivate", "mark 1", "reconnect " + URL_A,
                "probe " + URL_B, "deactivate", "mark 2", "reconnect " + URL_B), events);
        assertEquals(Set.of(2L), activeIds);
        assertEquals(URL_B, liveConfig.getUrl());
        assertTrue(liveConfig.isExternal());
    }

    private static BackendConnection connection(Long id, String name, String url) {
        return BackendConnection.builder()
                .id(id)
                .name(name)
                .url(url)
                .password("pw-" + name)
                .build();
    }
}
