package com.power.anomaly.config;

import com.power.anomaly.engine.isolationforest.IsolationForestTrainer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService treeBuildExecutor(DetectionConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, config.getTrainingThreads()), r -> {
            Thread t = new Thread(r, "tree-builder-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public IsolationForestTrainer isolationForestTrainer(DetectionConfig config, ExecutorService treeBuildExecutor) {
        return config.getTrainingThreads() > 1
                ? new IsolationForestTrainer(treeBuildExecutor)
                : new IsolationForestTrainer();
    }
}
