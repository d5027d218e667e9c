package com.factryl.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void normalizeTextLowercasesCollapsesWhitespaceAndStripsPunctuation() {
        assertThat(TextNormalizer.normalizeText("  Hello,   World!\n\tAgain ")).isEqualTo("hello world again");
        assertThat(TextNormalizer.normalizeText("Déjà vu: Café")).isEqualTo("déjà vu café");
        assertThat(TextNormalizer.normalizeText(null)).isEmpty();
    }

    @Test
    void normalizeUrlDropsTrackingParamsTrailingSlashAndWww() {
        assertThat(TextNormalizer.normalizeUrl("https://www.Example.com/news/?utm_source=feed&ref=home"))
                .isEqualTo("https://example.com/news");
        assertThat(TextNormalizer.normalizeUrl("https://example.com/news?id=5&utm_medium=social"))
                .isEqualTo("https://example.com/news?id=5");
        assertThat(TextNormalizer.normalizeUrl("www.example.com/a/")).isEqualTo("example.com/a");
    }

    @Test
    void normalizeUrlKeepsFragment() {
        assertThat(TextNormalizer.normalizeUrl("https://example.com/page?source=rss#comments"))
                .isEqualTo("https://example.com/page#comments");
    }

    @Test
    void normalizeUrlOfBlankIsEmpty() {
        assertThat(TextNormalizer.normalizeUrl(null)).isEmpty();
        assertThat(TextNormalizer.normalizeUrl("   ")).isEmpty();
    }

    @Test
    void md5HexOfUtf8Bytes() {
        assertThat(TextNormalizer.md5Hex("abc")).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }
}
