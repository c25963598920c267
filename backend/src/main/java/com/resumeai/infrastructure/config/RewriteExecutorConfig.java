package com.resumeai.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RewriteExecutorConfig {

    /**
     * Pool for parallel bullet rewrites, sized by {@code rewrite.parallel.max-concurrency}.
     */
    @Bean(name = "rewriteExecutor", destroyMethod = "shutdown")
    public ExecutorService rewriteExecutor(RewriteProperties properties) {
        int threads = Math.max(1, properties.parallel().maxConcurrency());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "rewrite-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
