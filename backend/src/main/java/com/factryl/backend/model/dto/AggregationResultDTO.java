package com.factryl.backend.model.dto;

import com.factryl.backend.model.content.ContentItem;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AggregationResultDTO {
    private String query;
    private List<ContentItem> items;
    private AggregationStatsDTO stats;
    private String timestamp;
}
