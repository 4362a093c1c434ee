package com.example.appruntime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.InternalServerErrorException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.transport.DockerHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DockerContainerRuntimeTest {

    private DockerClient dockerClient;
    private PullImageCmd pullCmd;
    private DockerContainerRuntime runtime;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        pullCmd = mock(PullImageCmd.class);
        when(dockerClient.pullImageCmd("ghcr.io/example/tips")).thenReturn(pullCmd);
        when(pullCmd.withTag(any())).thenReturn(pullCmd);
        runtime = new DockerContainerRuntime(dockerClient, mock(DockerHttpClient.class), Duration.ofSeconds(5));
    }

    @Test
    void testPullReportsProgress() {
        PullResponseItem item = mock(PullResponseItem.class);
        when(item.getId()).thenReturn("a1b2");
        when(item.getStatus()).thenReturn("Download complete");
        when(pullCmd.exec(any(PullImageResultCallback.class))).thenAnswer(invocation -> {
            PullImageResultCallback callback = invocation.getArgument(0);
            callback.onNext(item);
            callback.onComplete();
            return callback;
        });

        List<String> progress = new ArrayList<>();
        runtime.pull("ghcr.io/example/tips:1.2.0", progress::add);

        verify(pullCmd).withTag("1.2.0");
        assertEquals(List.of("a1b2: Download complete"), progress);
    }

    @Test
    void testPullFailureIsWrapped() {
        when(pullCmd.exec(any(PullImageResultCallback.class))).thenAnswer(invocation -> {
            PullImageResultCallback callback = invocation.getArgument(0);
            callback.onError(new DockerClientException("Could not pull image: manifest unknown"));
            return callback;
        });

        ContainerRuntimeException e = assertThrows(ContainerRuntimeException.class,
                () -> runtime.pull("ghcr.io/example/tips", progress -> { }));

        assertTrue(e.getMessage().contains("manifest unknown"));
        assertInstanceOf(DockerClientException.class, e.getCause());
        verify(pullCmd).withTag("latest");
    }

    @Test
    void testPullTimesOut() {
        // 回调永不完成
        when(pullCmd.exec(any(PullImageResultCallback.class))).thenAnswer(invocation -> invocation.getArgument(0));
        DockerContainerRuntime impatient = new DockerContainerRuntime(dockerClient, mock(DockerHttpClient.class),
                Duration.ofMillis(100));

        ContainerRuntimeException e = assertThrows(ContainerRuntimeException.class,
                () -> impatient.pull("ghcr.io/example/tips", progress -> { }));

        assertTrue(e.getMessage().startsWith("Timed out pulling"));
    }

    @Test
    void testInspectDistinguishesMissingContainer() {
        InspectContainerCmd missing = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd("gone")).thenReturn(missing);
        when(missing.exec()).thenThrow(new NotFoundException("No such container: gone"));

        InspectContainerCmd broken = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd("broken")).thenReturn(broken);
        when(broken.exec()).thenThrow(new InternalServerErrorException("daemon unavailable"));

        assertThrows(ContainerNotFoundException.class, () -> runtime.inspect("gone"));
        ContainerRuntimeException e = assertThrows(ContainerRuntimeException.class, () -> runtime.inspect("broken"));
        assertFalse(e instanceof ContainerNotFoundException);
    }
}
