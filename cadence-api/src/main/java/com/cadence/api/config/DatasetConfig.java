package com.cadence.api.config;

import com.cadence.api.dataset.DatasetIdGenerator;
import com.cadence.core.schema.DatasetSchemaValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Wires the core validator and the dataset id source into the application context.
 */
@Configuration
public class DatasetConfig {

    @Bean
    public DatasetSchemaValidator datasetSchemaValidator(ObjectMapper objectMapper) {
        return new DatasetSchemaValidator(objectMapper);
    }

    @Bean
    public DatasetIdGenerator datasetIdGenerator() {
        return UUID::randomUUID;
    }
}
