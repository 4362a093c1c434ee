package com.example.appruntime.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerClientException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.HealthCheck;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.transport.DockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 基于 docker-java 的容器运行时实现。
 * <p>
 * 常规命令走 {@link DockerClient}；日志和 exec 输出直接读取 Engine API 的原始多路复用流，
 * 交给 {@link LogDemultiplexer} 解析。
 */
@Component
@Slf4j
public class DockerContainerRuntime implements ContainerRuntime {

    private final DockerClient dockerClient;
    private final DockerHttpClient dockerHttpClient;
    private final Duration pullTimeout;

    public DockerContainerRuntime(DockerClient dockerClient,
            DockerHttpClient dockerHttpClient,
            @Value("${app.docker.pull-timeout:10m}") Duration pullTimeout) {
        this.dockerClient = dockerClient;
        this.dockerHttpClient = dockerHttpClient;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public List<ContainerSummary> list(Map<String, String> labelFilter) {
        try {
            List<Container> containers = dockerClient.listContainersCmd()
                    .withShowAll(true)
                    .withLabelFilter(labelFilter)
                    .exec();

            return containers.stream()
                    .map(c -> new ContainerSummary(
                            c.getId().length() > 12 ? c.getId().substring(0, 12) : c.getId(),
                            firstName(c.getNames()),
                            c.getState(),
                            c.getLabels() == null ? Collections.emptyMap() : c.getLabels()))
                    .toList();
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to list containers: " + e.getMessage(), e);
        }
    }

    @Override
    public ContainerState inspect(String name) {
        try {
            InspectContainerResponse info = dockerClient.inspectContainerCmd(name).exec();
            InspectContainerResponse.ContainerState state = info.getState();

            boolean running = Boolean.TRUE.equals(state.getRunning());
            String health = state.getHealth() != null ? state.getHealth().getStatus() : null;
            return new ContainerState(name, running, state.getStatus(), health);
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(name);
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to inspect " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String create(ContainerSpec spec) {
        HostConfig hostConfig = HostConfig.newHostConfig()
                .withNetworkMode(spec.network())
                .withRestartPolicy(RestartPolicy.parse(spec.restartPolicy()))
                .withMemory(spec.memoryBytes())
                .withNanoCPUs(spec.nanoCpus());

        HealthCheck healthCheck = new HealthCheck()
                .withTest(spec.healthcheckTest())
                .withInterval(spec.healthcheckInterval().toNanos())
                .withTimeout(spec.healthcheckTimeout().toNanos())
                .withRetries(spec.healthcheckRetries())
                .withStartPeriod(spec.healthcheckStartPeriod().toNanos());

        try {
            String id = dockerClient.createContainerCmd(spec.image())
                    .withName(spec.name())
                    .withEnv(spec.env())
                    .withLabels(spec.labels())
                    .withHostConfig(hostConfig)
                    .withHealthcheck(healthCheck)
                    .exec()
                    .getId();
            log.info("[Docker] Created container {} ({}) from {}", spec.name(), shortId(id), spec.image());
            return id;
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to create " + spec.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void start(String name) {
        try {
            dockerClient.startContainerCmd(name).exec();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(name);
        } catch (NotModifiedException e) {
            log.debug("[Docker] Container {} already started", name);
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to start " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void stop(String name, int graceSeconds) {
        try {
            dockerClient.stopContainerCmd(name).withTimeout(graceSeconds).exec();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(name);
        } catch (NotModifiedException e) {
            log.debug("[Docker] Container {} already stopped", name);
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to stop " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void remove(String name, boolean force) {
        try {
            dockerClient.removeContainerCmd(name).withForce(force).exec();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(name);
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to remove " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void pull(String image, Consumer<String> onProgress) {
        int slash = image.lastIndexOf('/');
        int colon = image.lastIndexOf(':');
        String repository = colon > slash ? image.substring(0, colon) : image;
        String tag = colon > slash ? image.substring(colon + 1) : "latest";

        try {
            boolean completed = dockerClient.pullImageCmd(repository)
                    .withTag(tag)
                    .exec(new PullImageResultCallback() {
                        @Override
                        public void onNext(PullResponseItem item) {
                            super.onNext(item);
                            if (item.getStatus() != null) {
                                String layer = item.getId() != null ? item.getId() + ": " : "";
                                onProgress.accept(layer + item.getStatus());
                            }
                        }
                    })
                    .awaitCompletion(pullTimeout.toMillis(), TimeUnit.MILLISECONDS);

            if (!completed) {
                throw new ContainerRuntimeException("Timed out pulling " + image + " after " + pullTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerRuntimeException("Interrupted while pulling " + image, e);
        } catch (DockerException | DockerClientException e) {
            // 拉取失败时回调抛出的是 DockerClientException
            throw new ContainerRuntimeException("Failed to pull " + image + ": " + e.getMessage(), e);
        }
    }

    @Override
    public InputStream logs(String name, int tail, boolean follow) {
        String path = "/containers/" + encode(name) + "/logs?stdout=1&stderr=1&timestamps=1"
                + "&tail=" + tail + "&follow=" + (follow ? 1 : 0);

        DockerHttpClient.Response response = dockerHttpClient.execute(DockerHttpClient.Request.builder()
                .method(DockerHttpClient.Request.Method.GET)
                .path(path)
                .build());

        checkStatus(response, name, "read logs of");

        return new FilterInputStream(response.getBody()) {
            @Override
            public void close() throws IOException {
                try {
                    super.close();
                } finally {
                    response.close();
                }
            }
        };
    }

    @Override
    public byte[] exec(String name, List<String> cmd) {
        String execId;
        try {
            execId = dockerClient.execCreateCmd(name)
                    .withCmd(cmd.toArray(new String[0]))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec()
                    .getId();
        } catch (NotFoundException e) {
            throw new ContainerNotFoundException(name);
        } catch (DockerException e) {
            throw new ContainerRuntimeException("Failed to exec in " + name + ": " + e.getMessage(), e);
        }

        byte[] body = "{\"Detach\":false,\"Tty\":false}".getBytes(StandardCharsets.UTF_8);
        DockerHttpClient.Request request = DockerHttpClient.Request.builder()
                .method(DockerHttpClient.Request.Method.POST)
                .path("/exec/" + execId + "/start")
                .headers(Collections.singletonMap("Content-Type", "application/json"))
                .body(new ByteArrayInputStream(body))
                .build();

        try (DockerHttpClient.Response response = dockerHttpClient.execute(request)) {
            checkStatus(response, name, "exec in");
            return response.getBody().readAllBytes();
        } catch (IOException e) {
            throw new ContainerRuntimeException("Failed to read exec output from " + name, e);
        }
    }

    private void checkStatus(DockerHttpClient.Response response, String name, String action) {
        int status = response.getStatusCode();
        if (status < 300) {
            return;
        }

        String message;
        try (DockerHttpClient.Response r = response) {
            message = new String(r.getBody().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            message = e.getMessage();
        }

        if (status == 404) {
            throw new ContainerNotFoundException(name);
        }
        throw new ContainerRuntimeException("Failed to " + action + " " + name + ": HTTP " + status + " " + message);
    }

    private static String firstName(String[] names) {
        if (names == null || names.length == 0) {
            return "";
        }
        return Arrays.stream(names).findFirst().map(n -> n.replaceFirst("^/", "")).orElse("");
    }

    private static String shortId(String id) {
        return id != null && id.length() > 12 ? id.substring(0, 12) : id;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
