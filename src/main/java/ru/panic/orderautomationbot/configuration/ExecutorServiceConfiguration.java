package ru.panic.orderautomationbot.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for detached work: rating probes, listing cache preload, Telegram command handling.
 */
@Configuration
public class ExecutorServiceConfiguration {
    @Bean(destroyMethod = "shutdown")
    public ExecutorService executorService() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "automation-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };

        return Executors.newCachedThreadPool(threadFactory);
    }
}
