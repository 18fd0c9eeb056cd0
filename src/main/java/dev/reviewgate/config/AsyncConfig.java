package dev.reviewgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async execution configuration.
 *
 * <p>Two bounded pools. {@code statusSyncExecutor} runs the post-commit Kantata push so a status
 * change response never waits on the external system. {@code reconciliationExecutor} fans out the
 * per-review Kantata reads of a sweep; its size is the concurrency cap that keeps us inside
 * Kantata's rate limits. Both propagate MDC so log lines keep their reviewId.
 *
 * <p>A full sync queue drops the push instead of failing the caller: the status change is already
 * committed and the review stays PENDING until the next reconciliation sweep pushes it.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(name = "statusSyncExecutor")
    public ThreadPoolTaskExecutor statusSyncExecutor(@Value("${reviewgate.sync.concurrency:2}") int concurrency,
                                                     @Value("${reviewgate.sync.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new DropWhenSaturatedPolicy());
        executor.setThreadNamePrefix("status-sync-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "reconciliationExecutor")
    public ThreadPoolTaskExecutor reconciliationExecutor(ReconciliationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(properties.concurrency());
        executor.setMaxPoolSize(properties.concurrency());
        // Unbounded queue: every linked review gets a slot, at most `concurrency` run at once
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("reconcile-");
        executor.initialize();
        return executor;
    }

    static class DropWhenSaturatedPolicy implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            log.warn("Status sync queue full ({} waiting), dropping push; reconciliation will retry it",
                    executor.getQueue().size());
        }
    }

    /**
     * Copies the caller's MDC onto the worker thread for the duration of the task.
     */
    static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
