package com.titlesearch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.titlesearch.pipeline.browser.BrowserPool;
import com.titlesearch.pipeline.browser.BrowserSessionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "shutdown")
    public BrowserPool browserPool(BrowserSessionFactory sessionFactory, PipelineProperties properties) {
        BrowserPool pool = new BrowserPool(sessionFactory, properties.getBrowser());
        if (properties.getBrowser().isEagerStart()) {
            pool.initialize();
        }
        return pool;
    }

    @Bean(name = "maintenanceScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService maintenanceScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("pipeline-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
