package com.factryl.backend.model.content;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Component scores in [0, 1], rounded to 3 decimals. {@code composite} is floored at the
 * configured minimum and may exceed 1 after source boosts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScoreBreakdown {
    private double relevance;
    private double credibility;
    private double recency;
    private double engagement;
    private double sourceBoost;
    private double composite;
}
