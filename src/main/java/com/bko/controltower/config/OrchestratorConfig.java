package com.bko.controltower.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("workflow-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-call-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService progressScheduler() {
        return Executors.newScheduledThreadPool(1, new CustomizableThreadFactory("vision-progress-"));
    }
}
