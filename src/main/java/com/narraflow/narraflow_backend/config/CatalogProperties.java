package com.narraflow.narraflow_backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the sheet service that owns variable definitions.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "narraflow.catalog")
public class CatalogProperties {

    /**
     * Base URL of the sheet service, without trailing slash.
     */
    private String baseUrl = "http://localhost:8081";

    private Duration connectTimeout = Duration.ofSeconds(2);

    private Duration readTimeout = Duration.ofSeconds(5);
}
