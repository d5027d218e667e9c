package com.factryl.backend.registry;

import com.factryl.backend.exception.AggregationConfigException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryLoaderTest {

    private final SourceRegistryLoader loader = new SourceRegistryLoader();

    @Test
    void loadsBundledRegistryOnUnitScale() {
        SourceRegistry registry = loader.load(new ClassPathResource("source-registry.yml"));

        SourceCredibility bbc = registry.lookup("bbc");
        assertThat(bbc.getScore()).isEqualTo(0.9);
        assertThat(bbc.getBias()).isEqualTo("Center");
        assertThat(bbc.getCategory()).isEqualTo("News");
        assertThat(bbc.getType()).isEqualTo("news");

        assertThat(registry.lookup("hackernews").getType()).isEqualTo("social");
        assertThat(registry.lookup("dictionary").getScore()).isEqualTo(0.95);
        assertThat(registry.all()).containsKeys("wikipedia", "youtube", "reddit", "twitter");
    }

    @Test
    void lookupIsCaseInsensitiveAndFallsBackForUnknownSources() {
        SourceRegistry registry = loader.load(new ClassPathResource("source-registry.yml"));

        assertThat(registry.lookup("BBC").getScore()).isEqualTo(0.9);
        assertThat(registry.isKnown("TechCrunch")).isTrue();
        assertThat(registry.isKnown("some_blog")).isFalse();

        SourceCredibility unknown = registry.lookup("some_blog");
        assertThat(unknown.getScore()).isEqualTo(0.5);
        assertThat(unknown.getType()).isEqualTo("unknown");
        assertThat(registry.lookup(null)).isEqualTo(registry.getFallback());
    }

    @Test
    void percentScaleIsConvertedToUnitScale() {
        SourceRegistry registry = loader.load(new ClassPathResource("registry-percent.yml"));

        assertThat(registry.lookup("bbc").getScore()).isEqualTo(0.9);
        assertThat(registry.getFallback().getScore()).isEqualTo(0.4);
        // missing fields come from the default record
        assertThat(registry.lookup("wikipedia").getBias()).isEqualTo("Unknown");
        assertThat(registry.lookup("wikipedia").getScore()).isEqualTo(0.85);
    }

    @Test
    void scoreOutsideDeclaredScaleIsRejected() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("registry-out-of-range.yml")))
                .isInstanceOf(AggregationConfigException.class)
                .hasMessageContaining("bbc");
    }

    @Test
    void unknownScaleIsRejected() {
        assertThatThrownBy(() -> loader.load(yaml("scale: stars\nsources: {}\n")))
                .isInstanceOf(AggregationConfigException.class)
                .hasMessageContaining("stars");
    }

    @Test
    void missingScoreIsRejected() {
        assertThatThrownBy(() -> loader.load(yaml("sources:\n  bbc:\n    bias: Center\n")))
                .isInstanceOf(AggregationConfigException.class)
                .hasMessageContaining("numeric score");
    }

    @Test
    void emptyRegistryIsRejected() {
        assertThatThrownBy(() -> loader.load(yaml("")))
                .isInstanceOf(AggregationConfigException.class);
    }

    private static ByteArrayResource yaml(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8));
    }
}
