package com.factryl.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for duplicate detection.
 * <p>
 * {@code titleThreshold}, {@code contentThreshold} and {@code minContentLength} are bound and
 * validated but not consulted; only the URL and overall thresholds decide duplicates.
 */
@Component
@ConfigurationProperties(prefix = "factryl.deduplicator")
@Validated
@Data
public class DeduplicatorProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double urlThreshold = 0.95;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double titleThreshold = 0.9;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double contentThreshold = 0.85;

    @Min(0)
    private int minContentLength = 50;
}
