package com.hockey.prediction.config;

import com.hockey.prediction.model.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * The built-in scoring model. Invalid configuration fails context startup.
     */
    @Bean
    public ScoringModel defaultScoringModel(PredictionProperties properties) {
        ScoringModel model = properties.toScoringModel();
        log.info("Loaded scoring model '{}' with weights {}", model.getModelId(), model.getWeights());
        return model;
    }

    /**
     * Runs one task per game and per player of a slate.
     */
    @Bean(name = "slateExecutor", destroyMethod = "shutdown")
    public ExecutorService slateExecutor(PredictionProperties properties) {
        PredictionProperties.Workers workers = properties.getWorkers();
        return boundedPool("slate", workers.getSlatePoolSize(), workers.getQueueCapacity(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Repository reads issued by slate tasks. Never waits on other work, so the slate
     * pool can block on it safely.
     */
    @Bean(name = "statsReadExecutor", destroyMethod = "shutdown")
    public ExecutorService statsReadExecutor(PredictionProperties properties) {
        PredictionProperties.Workers workers = properties.getWorkers();
        return boundedPool("stats-read", workers.getReadPoolSize(), workers.getQueueCapacity(),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ExecutorService boundedPool(String name, int threads, int queueCapacity,
                                               RejectedExecutionHandler rejection) {
        if (threads <= 0 || queueCapacity <= 0) {
            throw new IllegalArgumentException(
                    "Worker pool '" + name + "' needs positive size and queue capacity");
        }
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                factory,
                rejection) {
            @Override
            protected void beforeExecute(Thread t, Runnable r) {
                // clear an interrupt left behind by a cancelled run
                if (t.isInterrupted()) {
                    Thread.interrupted();
                }
                super.beforeExecute(t, r);
            }
        };
    }
}
