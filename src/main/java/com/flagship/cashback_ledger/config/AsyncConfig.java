package com.flagship.cashback_ledger.config;

import com.flagship.cashback_ledger.observability.CorrelationContext;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executors for work that runs off the request thread.
 *
 * Both pools reject when full rather than running on the caller: replication
 * tasks stay in the outbox for the poller, and notifications are best effort.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "replicationExecutor")
    public ThreadPoolTaskExecutor replicationExecutor(
            @Value("${replication.executor.core-size:2}") int coreSize,
            @Value("${replication.executor.max-size:8}") int maxSize,
            @Value("${replication.executor.queue-capacity:1000}") int queueCapacity) {
        return executor("replication-", coreSize, maxSize, queueCapacity);
    }

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(
            @Value("${notification.executor.core-size:1}") int coreSize,
            @Value("${notification.executor.max-size:4}") int maxSize,
            @Value("${notification.executor.queue-capacity:500}") int queueCapacity) {
        return executor("notification-", coreSize, maxSize, queueCapacity);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int coreSize, int maxSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setTaskDecorator(correlationPropagatingDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    /**
     * Carries the submitting thread's MDC (and so its correlation id) into the worker.
     */
    static TaskDecorator correlationPropagatingDecorator() {
        return task -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                    CorrelationContext.setCorrelationId(context.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
                }
                try {
                    task.run();
                } finally {
                    CorrelationContext.clear();
                    if (previous == null) {
                        MDC.clear();
                    } else {
                        MDC.setContextMap(previous);
                    }
                }
            };
        };
    }
}
