package com.narraflow.narraflow_backend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "narraflow.trash")
public class TrashProperties {

    /**
     * Days a deleted flow stays recoverable. 0 disables the purge.
     */
    private int retentionDays = 30;

    private long purgeIntervalMs = 3_600_000;
}
