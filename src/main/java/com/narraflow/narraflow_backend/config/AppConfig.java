package com.narraflow.narraflow_backend.config;

import com.narraflow.narraflow_backend.collab.LeaseClock;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

    /** Client for the sheet service. */
    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, CatalogProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    @Bean
    public LeaseClock leaseClock() {
        return LeaseClock.system();
    }
}
