package com.calypso.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "calypso.sandbox.provider", havingValue = "local", matchIfMissing = true)
    public BuildSandbox localProcessSandbox() {
        return new LocalProcessSandbox();
    }

    @Bean
    @ConditionalOnProperty(name = "calypso.sandbox.provider", havingValue = "docker")
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "calypso.sandbox.provider", havingValue = "docker")
    public BuildSandbox dockerBuildSandbox(DockerClient dockerClient, SandboxProperties properties) {
        return new DockerBuildSandbox(dockerClient, properties.getImage(),
                properties.getMemoryLimitMb(), properties.getCpuCount());
    }
}
