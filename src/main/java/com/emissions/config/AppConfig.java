package com.emissions.config;

import com.emissions.dataset.CsvEmissionsDataset;
import com.emissions.dataset.EmissionsDataset;
import com.emissions.service.BoundedCalls;
import com.emissions.store.InMemoryKeyValueStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Application-wide Spring configuration.
 */
@Configuration
public class AppConfig {

    /**
     * Worker pool for store and dataset calls, so the request thread can stop waiting
     * once a query's deadline passes.
     */
    @Bean
    public ThreadPoolTaskExecutor queryExecutor(
            @Value("${emissions.query.executor.pool-size:8}") int poolSize,
            @Value("${emissions.query.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("emissions-query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    public BoundedCalls boundedCalls(@Qualifier("queryExecutor") ThreadPoolTaskExecutor queryExecutor) {
        return new BoundedCalls(queryExecutor);
    }

    /**
     * The authoritative dataset, read once at startup.
     */
    @Bean
    public EmissionsDataset emissionsDataset(
            ResourceLoader resourceLoader,
            @Value("${emissions.dataset.location:file:uc_results_gf.csv}") String location,
            @Value("${emissions.dataset.date-pattern:d/M/yy}") String datePattern) {
        return CsvEmissionsDataset.load(resourceLoader.getResource(location), datePattern);
    }

    /**
     * Takes the place of Spring Boot's Redis health check when the cache is kept in
     * memory, so {@code /actuator/health} does not report an unused Redis as DOWN.
     * Boot's own indicator backs off when a bean with this name exists.
     */
    @Bean(name = "redisHealthContributor")
    @ConditionalOnProperty(name = "emissions.cache.store", havingValue = "memory")
    public HealthIndicator inMemoryCacheHealth(InMemoryKeyValueStore store) {
        return () -> Health.up()
                .withDetail("store", "memory")
                .withDetail("entries", store.size())
                .build();
    }
}
