package com.taskwarden.pool;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ServerPoolConfig {

    @Bean
    public WorkerLauncher workerLauncher() {
        return new ProcessWorkerLauncher();
    }

    @Bean
    public HealthProbe healthProbe(ServerPoolProperties properties) {
        return new HttpHealthProbe(Duration.ofMillis(properties.getHealthCheckTimeoutMs()));
    }

    @Bean
    public PoolInfrastructure poolInfrastructure(WorkerLauncher launcher, HealthProbe healthProbe,
                                                 ServerPoolProperties properties, PoolObservability observability) {
        return new PoolInfrastructure(launcher, healthProbe, new PortAllocator(), Clock.systemUTC(),
                observability, Duration.ofMillis(properties.getPollIntervalMs()), properties.getMaxWarmupFailures());
    }

    @Bean
    public ServerPoolRegistry serverPoolRegistry(PoolRuntime runtime, ServerPoolProperties properties,
                                                 PoolInfrastructure infrastructure) {
        return new ServerPoolRegistry(runtime, properties, infrastructure);
    }
}
