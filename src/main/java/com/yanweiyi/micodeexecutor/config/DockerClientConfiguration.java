package com.yanweiyi.micodeexecutor.config;

import cn.hutool.core.util.StrUtil;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 工作节点使用的 Docker 客户端
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "micode.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DockerClientConfiguration {

    @Bean
    public DockerClient dockerClient(MicodeProperties properties) {
        // 配置连接的 Docker 服务，未配置时使用 DOCKER_HOST 或本地 socket
        DefaultDockerClientConfig.Builder configBuilder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        String dockerHost = properties.getDocker().getHost();
        if (StrUtil.isNotBlank(dockerHost)) {
            configBuilder.withDockerHost(dockerHost);
        }
        DockerClientConfig config = configBuilder.build();

        // 创建 DockerHttpClient
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(100)
                .connectionTimeout(Duration.ofSeconds(10))
                .build();

        log.info("docker client created, host: {}", config.getDockerHost());
        return DockerClientImpl.getInstance(config, httpClient);
    }
}
