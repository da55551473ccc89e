package uk.gegc.copilotexport.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for the asynchronous part of exports (snapshot capture and decoding).
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.export.core-pool-size:2}")
    private int exportCorePoolSize;

    @Value("${async.export.max-pool-size:4}")
    private int exportMaxPoolSize;

    @Value("${async.export.queue-capacity:25}")
    private int exportQueueCapacity;

    @Value("${async.export.keep-alive-seconds:60}")
    private int exportKeepAliveSeconds;

    @Bean(name = "exportTaskExecutor")
    public Executor exportTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(exportCorePoolSize);
        executor.setMaxPoolSize(exportMaxPoolSize);
        executor.setQueueCapacity(exportQueueCapacity);
        executor.setKeepAliveSeconds(exportKeepAliveSeconds);
        executor.setThreadNamePrefix("export-");

        // Caller runs the task if the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Export Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                exportCorePoolSize, exportMaxPoolSize, exportQueueCapacity, exportKeepAliveSeconds);

        return executor;
    }
}
