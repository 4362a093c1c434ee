package com.example.appruntime.service;

import com.example.appruntime.docker.ContainerNotFoundException;
import com.example.appruntime.docker.ContainerRuntime;
import com.example.appruntime.docker.ContainerRuntimeException;
import com.example.appruntime.docker.ContainerSpec;
import com.example.appruntime.docker.ContainerState;
import com.example.appruntime.docker.ContainerSummary;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 内存中的容器运行时，记录调用序列供断言。
 */
class FakeContainerRuntime implements ContainerRuntime {

    static final class FakeContainer {
        final ContainerSpec spec;
        volatile boolean running;
        volatile String health;

        FakeContainer(ContainerSpec spec) {
            this.spec = spec;
        }
    }

    final Map<String, FakeContainer> containers = new ConcurrentHashMap<>();
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    final Set<String> pulledImages = Collections.synchronizedSet(new HashSet<>());
    final Set<String> failingInspect = Collections.synchronizedSet(new HashSet<>());
    volatile boolean failPull;
    volatile byte[] logBytes = new byte[0];

    void addContainer(String name, boolean running) {
        FakeContainer container = new FakeContainer(ContainerSpec.builder().name(name).image("existing").build());
        container.running = running;
        containers.put(name, container);
    }

    long count(String call) {
        return calls.stream().filter(c -> c.equals(call)).count();
    }

    @Override
    public List<ContainerSummary> list(Map<String, String> labelFilter) {
        calls.add("list");
        List<ContainerSummary> result = new ArrayList<>();
        containers.forEach((name, container) -> {
            boolean matches = labelFilter.entrySet().stream()
                    .allMatch(e -> e.getValue().equals(container.spec.labels().get(e.getKey())));
            if (matches) {
                result.add(new ContainerSummary("id-" + name, name,
                        container.running ? "running" : "exited", container.spec.labels()));
            }
        });
        return result;
    }

    @Override
    public ContainerState inspect(String name) {
        calls.add("inspect:" + name);
        if (failingInspect.contains(name)) {
            throw new ContainerRuntimeException("daemon unavailable");
        }
        FakeContainer container = require(name);
        return new ContainerState(name, container.running, container.running ? "running" : "exited",
                container.health);
    }

    @Override
    public String create(ContainerSpec spec) {
        calls.add("create:" + spec.name());
        if (containers.containsKey(spec.name())) {
            throw new ContainerRuntimeException("Conflict: name already in use " + spec.name());
        }
        containers.put(spec.name(), new FakeContainer(spec));
        return "id-" + spec.name();
    }

    @Override
    public void start(String name) {
        calls.add("start:" + name);
        require(name).running = true;
    }

    @Override
    public void stop(String name, int graceSeconds) {
        calls.add("stop:" + name);
        require(name).running = false;
    }

    @Override
    public void remove(String name, boolean force) {
        calls.add("remove:" + name);
        FakeContainer container = require(name);
        if (container.running && !force) {
            throw new ContainerRuntimeException("Cannot remove running container " + name);
        }
        containers.remove(name);
    }

    @Override
    public void pull(String image, Consumer<String> onProgress) {
        calls.add("pull:" + image);
        if (failPull) {
            throw new ContainerRuntimeException("pull access denied for " + image);
        }
        onProgress.accept("Downloading");
        pulledImages.add(image);
    }

    @Override
    public InputStream logs(String name, int tail, boolean follow) {
        calls.add("logs:" + name);
        require(name);
        return new ByteArrayInputStream(logBytes);
    }

    @Override
    public byte[] exec(String name, List<String> cmd) {
        calls.add("exec:" + name);
        require(name);
        return String.join(" ", cmd).getBytes();
    }

    private FakeContainer require(String name) {
        FakeContainer container = containers.get(name);
        if (container == null) {
            throw new ContainerNotFoundException(name);
        }
        return container;
    }
}
