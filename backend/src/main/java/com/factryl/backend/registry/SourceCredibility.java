package com.factryl.backend.registry;

import lombok.Builder;
import lombok.Value;

/**
 * Credibility metadata for one source. {@code score} is always on the unit scale.
 */
@Value
@Builder
public class SourceCredibility {

    public static final SourceCredibility UNKNOWN = SourceCredibility.builder()
            .score(0.5)
            .bias("Unknown")
            .category("Uncategorized")
            .type("unknown")
            .build();

    double score;
    String bias;
    String category;
    String type;
}
