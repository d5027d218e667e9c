package com.factryl.backend.model.content;

import com.factryl.backend.model.ContentRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standardized item flowing through combine, deduplicate and score.
 * <p>
 * Created by the combiner; only the deduplicator touches {@code tags} and
 * {@code duplicateSources}, only the scorer sets {@code score}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentItem implements ContentRecord {
    private String id;
    private String title;
    private String content;
    private String url;
    private String author;
    private String source;

    // Frozen from the source registry at combine time
    private String sourceType;
    private String sourceCategory;
    private double credibilityScore;
    private String biasRating;

    private String published; // kept as received so malformed values stay visible
    private Boolean publishedDefaulted; // true when the collector sent no date and "now" was filled in

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();
    @Builder.Default
    private List<DuplicateSource> duplicateSources = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Double relevanceScore;
    private ContentAnalysis analysis;
    private ScoreBreakdown score;
}
