package com.codeagent.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for agent steps.
 *
 * Each step of every running task occupies one thread until its model call and
 * tool calls return. Steps are never interrupted: an abandoned step keeps its
 * thread until its model or tool call returns on its own. A step the pool
 * rejects fails the task.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentStepExecutor")
    public Executor agentStepExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(64);
        executor.setThreadNamePrefix("agent-step-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
