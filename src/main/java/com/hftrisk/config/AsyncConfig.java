package com.hftrisk.config;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor behind {@code @Async} risk listeners such as exposure-reduction alerts.
 * Work that does not fit in the queue runs on the publishing thread.
 *
 * <p>Properties prefix: {@code hftrisk.async.*}
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    private final int corePoolSize;
    private final int maxPoolSize;
    private final int queueCapacity;
    private final Duration awaitTermination;

    public AsyncConfig(
            @Value("${hftrisk.async.core-pool-size:2}") int corePoolSize,
            @Value("${hftrisk.async.max-pool-size:4}") int maxPoolSize,
            @Value("${hftrisk.async.queue-capacity:500}") int queueCapacity,
            @Value("${hftrisk.async.await-termination:10s}") Duration awaitTermination) {
        this.corePoolSize = corePoolSize;
        this.maxPoolSize = maxPoolSize;
        this.queueCapacity = queueCapacity;
        this.awaitTermination = awaitTermination;
    }

    @Bean("riskEventExecutor")
    public ThreadPoolTaskExecutor riskEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("risk-listener-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(awaitTermination.toMillis());
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return riskEventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return this::logListenerFailure;
    }

    private void logListenerFailure(Throwable throwable, Method method, Object... params) {
        log.error("Async risk listener failed: listener={}.{}, reason={}",
                method.getDeclaringClass().getSimpleName(), method.getName(), throwable.getMessage(), throwable);
    }
}
