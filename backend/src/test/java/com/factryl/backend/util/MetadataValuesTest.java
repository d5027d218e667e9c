package com.factryl.backend.util;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataValuesTest {

    @Test
    void numberAcceptsNumbersAndNumericStrings() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("views", 1500);
        metadata.put("likes", "12,345");
        metadata.put("score", "n/a");
        metadata.put("ratio", Double.NaN);

        assertThat(MetadataValues.number(metadata, "views", 0)).isEqualTo(1500.0);
        assertThat(MetadataValues.number(metadata, "likes", 0)).isEqualTo(12345.0);
        assertThat(MetadataValues.number(metadata, "score", 7)).isEqualTo(7.0);
        assertThat(MetadataValues.number(metadata, "ratio", 0.5)).isEqualTo(0.5);
        assertThat(MetadataValues.number(metadata, "missing", 0)).isEqualTo(0.0);
        assertThat(MetadataValues.number(null, "views", 3)).isEqualTo(3.0);
    }

    @Test
    void flagAcceptsBooleansAndBooleanStrings() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("verified", true);
        metadata.put("pinned", "TRUE");
        metadata.put("promoted", 1);

        assertThat(MetadataValues.flag(metadata, "verified")).isTrue();
        assertThat(MetadataValues.flag(metadata, "pinned")).isTrue();
        assertThat(MetadataValues.flag(metadata, "promoted")).isFalse();
        assertThat(MetadataValues.flag(null, "verified")).isFalse();
    }

    @Test
    void roundIsHalfEvenOnTheBinaryValue() {
        assertThat(MetadataValues.round(0.1009090909, 3)).isEqualTo(0.101);
        assertThat(MetadataValues.round(0.0625, 3)).isEqualTo(0.062);
        assertThat(MetadataValues.round(66.66666, 1)).isEqualTo(66.7);
    }
}
