package com.example.mailagent.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(MailAgentProperties.class)
public class EngineConfig {

    /**
     * Runs external port calls so each one can be bounded by a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService portCallExecutor(MailAgentProperties properties) {
        int threads = Math.max(2, properties.getWorker().getThreads() * 2);
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(256), namedThreads("port-call-"));
    }

    /**
     * Drives instances after ingress and recovery so HTTP threads return immediately.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService workflowWorkerExecutor(MailAgentProperties properties) {
        int threads = Math.max(1, properties.getWorker().getThreads());
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(1024), namedThreads("workflow-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
