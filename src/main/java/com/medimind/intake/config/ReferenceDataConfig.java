package com.medimind.intake.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.reference.ReferenceDataLoader;
import com.medimind.intake.reference.ReferenceDataTables;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

@Configuration
public class ReferenceDataConfig {

    @Value("${app.reference.location:classpath:reference/reference-ranges.json}")
    private Resource referenceLocation;

    @Bean
    public ReferenceDataTables referenceDataTables(ObjectMapper objectMapper) {
        return new ReferenceDataLoader(objectMapper).load(referenceLocation);
    }
}
