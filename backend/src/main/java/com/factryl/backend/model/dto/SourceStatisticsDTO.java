package com.factryl.backend.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SourceStatisticsDTO {
    private int totalItems;
    private Map<String, Integer> sources; // per source type
    private Map<String, Double> sourcePercentages;
    private int uniqueSources;
}
