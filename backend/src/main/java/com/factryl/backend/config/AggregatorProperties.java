package com.factryl.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "factryl.aggregator")
@Validated
@Data
public class AggregatorProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double deduplicationThreshold = 0.8;

    @Min(0)
    private int maxArticlesPerSource = 5;

    @Min(0)
    private int minArticleLength = 100;
}
