package com.project.optical.contrast.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for computing several line cuts of the same image in parallel.
 * The image is read-only, so measurements need no coordination.
 */
@Configuration
public class MeasurementExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService measurementExecutor(@Value("${app.contrast.parallelism:4}") int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("app.contrast.parallelism must be at least 1: " + parallelism);
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "contrast-measure-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(parallelism, threads);
    }
}
