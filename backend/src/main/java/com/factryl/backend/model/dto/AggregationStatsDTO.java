package com.factryl.backend.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregationStatsDTO {
    private int totalItemsFound;
    private int uniqueItems;
    private int duplicatesRemoved;
    private int finalItems;
    private int sourcesSearched;
    private int successfulSources;
    private long processingTimeMs;
    private double averageCredibility;
}
