package com.soora.shop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for independent read queries that a single request fans out
 * (the dashboard aggregates).
 *
 * @author Soora Platform Team
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String QUERY_EXECUTOR = "queryExecutor";

    @Value("${app.query-executor.core-pool-size:5}")
    private int corePoolSize;

    @Value("${app.query-executor.max-pool-size:10}")
    private int maxPoolSize;

    @Value("${app.query-executor.queue-capacity:100}")
    private int queueCapacity;

    /**
     * CallerRunsPolicy: when the queue is full the request thread runs the query itself.
     */
    @Bean(name = QUERY_EXECUTOR)
    public Executor queryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("query-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        logger.info("Query executor initialized: corePoolSize={}, maxPoolSize={}, queueCapacity={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);

        return executor;
    }
}
