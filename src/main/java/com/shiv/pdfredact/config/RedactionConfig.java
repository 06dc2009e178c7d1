package com.shiv.pdfredact.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(RedactionProperties.class)
public class RedactionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService redactionExecutor(RedactionProperties properties) {
        int configured = properties.getJobs().getParallelism();
        int parallelism = configured <= 0 ? Runtime.getRuntime().availableProcessors() : configured;
        return Executors.newFixedThreadPool(parallelism);
    }
}
