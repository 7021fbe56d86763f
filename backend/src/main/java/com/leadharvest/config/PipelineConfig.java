package com.leadharvest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService jobExecutor(PipelineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(properties.getJobs().getWorkerCount(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("pipeline-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CrmSettings crmSettings(PipelineProperties properties) {
        return CrmSettings.from(properties.getCrm());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
