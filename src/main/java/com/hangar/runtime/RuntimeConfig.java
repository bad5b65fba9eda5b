package com.hangar.runtime;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.hangar.config.HangarProperties;
import com.hangar.config.StorageLayout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RuntimeConfig {

    @Bean
    public DockerClient dockerClient(HangarProperties properties) {
        // DOCKER_HOST from the environment wins over hangar.docker.host
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDocker().getHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(10))
                .responseTimeout(Duration.ofMinutes(5))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public PortAllocator portAllocator(HangarProperties properties) {
        return new PortAllocator(properties.getDocker().getBasePort(), properties.getDocker().getMaxPort());
    }

    @Bean
    public ContainerRuntime containerRuntime(DockerClient dockerClient, HangarProperties properties,
                                             StorageLayout layout, PortAllocator portAllocator) {
        return new DockerContainerRuntime(dockerClient, properties, layout, portAllocator);
    }
}
