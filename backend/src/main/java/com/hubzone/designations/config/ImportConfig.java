package com.hubzone.designations.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ImportConfig {

    @Bean(name = "datasetFetchExecutor", destroyMethod = "shutdown")
    public ExecutorService datasetFetchExecutor(ImportProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ImportProperties properties) {
        int size = Math.max(4, properties.getFetch().getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "importRunExecutor", destroyMethod = "shutdown")
    public ExecutorService importRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
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
