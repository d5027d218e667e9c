package com.factryl.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "factryl.pipeline")
@Validated
@Data
public class PipelineProperties {

    // Items returned by a pipeline run when the request does not say
    @Min(1)
    private int maxResults = 25;
}
