package com.factryl.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "factryl.combiner")
@Validated
@Data
public class CombinerProperties {

    @Min(0)
    private int maxItemsPerSource = 100;

    // Copy unmodelled raw fields into ContentItem.metadata
    private boolean preserveSourceMetadata = true;
}
