package com.example.appruntime.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Docker Engine 客户端配置。
 * <p>
 * 连接和响应超时保证每次运行时调用都有上限；镜像拉取另有独立超时。
 */
@Configuration
@Slf4j
public class DockerConfig {

    @Bean
    public DockerClientConfig dockerClientConfig(
            @Value("${app.docker.host:unix:///var/run/docker.sock}") String dockerHost) {
        log.info("Docker host: {}", dockerHost);
        return DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
    }

    @Bean(destroyMethod = "close")
    public DockerHttpClient dockerHttpClient(DockerClientConfig config,
            @Value("${app.docker.connect-timeout:10s}") Duration connectTimeout,
            @Value("${app.docker.response-timeout:60s}") Duration responseTimeout) {
        return new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(50)
                .connectionTimeout(connectTimeout)
                .responseTimeout(responseTimeout)
                .build();
    }

    @Bean(destroyMethod = "close")
    public DockerClient dockerClient(DockerClientConfig config, DockerHttpClient dockerHttpClient) {
        return DockerClientImpl.getInstance(config, dockerHttpClient);
    }
}
