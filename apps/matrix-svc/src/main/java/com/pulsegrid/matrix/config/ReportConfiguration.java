package com.pulsegrid.matrix.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReportConfiguration {

    @Bean
    public ReportDefinition reportDefinition(PulsegridProperties properties) {
        return ReportDefinition.from(properties);
    }
}
