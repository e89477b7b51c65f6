package dev.pairreview.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Executors for analysis work and progress delivery.
 *
 * <p>Analyses and council voices spend their time waiting on provider subprocesses, so they run
 * on a cached pool that grows with the number of voices in flight. MDC (notably {@code runId})
 * is copied onto every worker thread.
 */
@Configuration
public class AsyncConfig {

    /**
     * ExecutorService for whole analyses and the CompletableFuture fan-out of council voices.
     */
    @Bean(name = "analysisExecutorService")
    public ExecutorService analysisExecutorService() {
        ExecutorService base = Executors.newCachedThreadPool(new CustomizableThreadFactory("analysis-"));
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Drains per-subscriber progress buffers so a slow subscriber never blocks a publisher.
     */
    @Bean(name = "progressDispatchExecutor")
    public ThreadPoolTaskExecutor progressDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("progress-");
        executor.initialize();
        return executor;
    }

    /**
     * Drains stdout and stderr of voice and git subprocesses. Two readers per process; the pool never
     * queues, so a saturated pool rejects a new process instead of leaving its pipes unread.
     */
    @Bean(name = "processIoExecutor")
    public ThreadPoolTaskExecutor processIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("process-io-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Propagates MDC context (runId, reviewId) from the submitting thread to the worker.
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

    /**
     * Wraps an ExecutorService to apply MDC propagation to all submitted tasks.
     */
    static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final MdcPropagatingTaskDecorator decorator;

        DelegatingExecutorService(ExecutorService delegate, MdcPropagatingTaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
