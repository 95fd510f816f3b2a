package com.tasklane.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class WorkerConfig {

    @Bean
    @ConditionalOnMissingBean(BuildAgent.class)
    @ConditionalOnProperty(name = "tasklane.worker.provider", havingValue = "process", matchIfMissing = true)
    public BuildAgent processBuildAgent(WorkerProperties properties, ObjectMapper objectMapper) {
        return new ProcessBuildAgent(properties.getCommand(), Path.of(properties.getWorkingDirectory()), objectMapper);
    }
}
