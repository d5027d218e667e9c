package com.factryl.backend.model.enums;

import com.factryl.backend.model.content.ScoreBreakdown;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import lombok.Getter;

/**
 * Score field used to order scored items, always descending.
 */
@Getter
public enum SortKey {
    RELEVANCE("relevance", ScoreBreakdown::getRelevance),
    RECENCY("recency", ScoreBreakdown::getRecency),
    CREDIBILITY("credibility", ScoreBreakdown::getCredibility),
    ENGAGEMENT("engagement", ScoreBreakdown::getEngagement),
    COMPOSITE("composite", ScoreBreakdown::getComposite);

    @JsonValue
    private final String value;
    private final ToDoubleFunction<ScoreBreakdown> extractor;

    SortKey(String value, ToDoubleFunction<ScoreBreakdown> extractor) {
        this.value = value;
        this.extractor = extractor;
    }

    /**
     * Case-insensitive lookup; {@code null} for unknown or missing values so the configured
     * default applies.
     */
    @JsonCreator
    public static SortKey fromValue(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SortKey key : values()) {
            if (key.value.equals(normalized)) {
                return key;
            }
        }
        return null;
    }

    public double extract(ScoreBreakdown score) {
        return score != null ? extractor.applyAsDouble(score) : 0.0;
    }
}
