package uk.gegc.aimeter.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for streamed runs.
 *
 * <p>The relay pool runs one pump per active run (provider stream, billing commits, event
 * forwarding). The SSE pool drains UI streams into emitters so servlet threads are released.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.relay.core-pool-size:8}")
    private int relayCorePoolSize;

    @Value("${async.relay.max-pool-size:32}")
    private int relayMaxPoolSize;

    @Value("${async.relay.queue-capacity:100}")
    private int relayQueueCapacity;

    @Value("${async.relay.keep-alive-seconds:60}")
    private int relayKeepAliveSeconds;

    @Value("${async.sse.core-pool-size:8}")
    private int sseCorePoolSize;

    @Value("${async.sse.max-pool-size:32}")
    private int sseMaxPoolSize;

    @Value("${async.sse.queue-capacity:100}")
    private int sseQueueCapacity;

    @Value("${async.sse.keep-alive-seconds:60}")
    private int sseKeepAliveSeconds;

    /**
     * Executor for run pumps. Billing commits happen on these threads, so shutdown waits for
     * in-flight runs to finish writing receipts.
     */
    @Bean(name = "relayTaskExecutor")
    public Executor relayTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(relayCorePoolSize);
        executor.setMaxPoolSize(relayMaxPoolSize);
        executor.setQueueCapacity(relayQueueCapacity);
        executor.setKeepAliveSeconds(relayKeepAliveSeconds);
        executor.setThreadNamePrefix("relay-");
        // caller runs when saturated; the pump completes before the UI stream is handed out
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Relay Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                relayCorePoolSize, relayMaxPoolSize, relayQueueCapacity, relayKeepAliveSeconds);
        return executor;
    }

    @Bean(name = "sseTaskExecutor")
    public Executor sseTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sseCorePoolSize);
        executor.setMaxPoolSize(sseMaxPoolSize);
        executor.setQueueCapacity(sseQueueCapacity);
        executor.setKeepAliveSeconds(sseKeepAliveSeconds);
        executor.setThreadNamePrefix("sse-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("SSE Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                sseCorePoolSize, sseMaxPoolSize, sseQueueCapacity, sseKeepAliveSeconds);
        return executor;
    }
}
