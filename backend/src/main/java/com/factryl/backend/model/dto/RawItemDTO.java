package com.factryl.backend.model.dto;

import com.factryl.backend.model.ContentRecord;
import com.factryl.backend.model.content.ContentAnalysis;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Item as received from a collector. Every field is optional; fields the collector sends
 * that are not modelled here are kept in {@link #getExtraFields()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RawItemDTO implements ContentRecord {
    private String id;
    private String title;
    private String content;
    private String url;
    private String author;
    private String published;
    private String source; // only set on flat lists, the combiner takes it from the map key
    private List<String> tags;
    private Map<String, Object> metadata;
    private Double relevanceScore;
    private ContentAnalysis analysis;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> extraFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtraField(String name, Object value) {
        if (extraFields == null) {
            extraFields = new LinkedHashMap<>();
        }
        extraFields.put(name, value);
    }
}
