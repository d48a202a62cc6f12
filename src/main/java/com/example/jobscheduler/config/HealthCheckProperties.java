package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Health check job configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "health-check")
public class HealthCheckProperties {

    /**
     * URL probed when the job row does not name one
     */
    private String defaultUrl;

    @Min(1)
    private int timeoutSeconds = 30;
}
