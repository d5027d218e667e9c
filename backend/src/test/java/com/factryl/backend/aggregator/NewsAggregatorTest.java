package com.factryl.backend.aggregator;

import com.factryl.backend.config.AggregatorProperties;
import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.dto.RawItemDTO;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NewsAggregatorTest {

    private static final List<String> STORIES = Arrays.asList(
            "Central bank holds interest rates steady amid persistent inflation worries across the eurozone economies this quarter.",
            "Local football club signs young striker from the academy after an impressive season in the regional youth league.",
            "New museum exhibition showcases ancient pottery recovered from a shipwreck discovered off the southern coastline.",
            "Researchers publish findings on drought resistant wheat varieties that could help farmers in arid climates adapt.",
            "City council approves funding for expanded cycling lanes and pedestrian zones throughout the historic downtown area.",
            "Streaming service announces documentary series following mountaineers attempting winter ascents in the Himalayas.");

    private AggregatorProperties properties;
    private NewsAggregator aggregator;

    @BeforeEach
    void setUp() {
        properties = new AggregatorProperties();
        aggregator = new NewsAggregator(properties);
    }

    @Test
    void capsEachSourceAtFiveKeepingFirstItems() {
        List<RawItemDTO> items = new ArrayList<>();
        for (int i = 0; i < STORIES.size(); i++) {
            items.add(raw("Story " + i, "Item " + i + ": " + STORIES.get(i), "Source A"));
        }

        List<RawItemDTO> result = aggregator.aggregate(items);

        assertThat(result).hasSize(5);
        assertThat(result).extracting(RawItemDTO::getTitle)
                .containsExactly("Story 0", "Story 1", "Story 2", "Story 3", "Story 4");
    }

    @Test
    void shortContentIsFilteredOut() {
        RawItemDTO tooShort = raw("Brief", "Too short", "Source A");
        RawItemDTO full = raw("Full", STORIES.get(0), "Source A");

        assertThat(aggregator.aggregate(Arrays.asList(tooShort, full)))
                .extracting(RawItemDTO::getTitle).containsExactly("Full");
    }

    @Test
    void lengthThresholdIsInclusive() {
        properties.setMinArticleLength(9);

        assertThat(aggregator.filterContent(List.of(raw("Brief", "Too short", "Source A")))).hasSize(1);
    }

    @Test
    void lengthIsCountedInCodePoints() {
        properties.setMinArticleLength(6);
        String fiveEmoji = "\uD83D\uDE00".repeat(5);

        assertThat(aggregator.filterContent(List.of(raw("Emoji", fiveEmoji, "Source A")))).isEmpty();
        assertThat(aggregator.filterContent(List.of(raw("Emoji", fiveEmoji + "!", "Source A")))).hasSize(1);
    }

    @Test
    void nearIdenticalContentIsDroppedAcrossSources() {
        RawItemDTO original = raw("Original", STORIES.get(2), "Source A");
        RawItemDTO syndicated = raw("Syndicated", STORIES.get(2).replace("New museum", "A new museum"), "Source B");
        RawItemDTO other = raw("Other", STORIES.get(3), "Source B");

        assertThat(aggregator.aggregate(Arrays.asList(original, syndicated, other)))
                .extracting(RawItemDTO::getTitle).containsExactly("Original", "Other");
    }

    @Test
    void paraphrasedHeadlinesWithSameBodyCollapseToOne() {
        List<RawItemDTO> items = Arrays.asList(
                raw("AI Makes Breakthrough in Protein Folding", "Scientists announce major AI breakthrough...", "Source A"),
                raw("Artificial Intelligence Solves Protein Folding", "Scientists announce major AI breakthrough...", "Source B"),
                raw("Completely Different Article", "This is about something else entirely...", "Source C"));

        assertThat(aggregator.deduplicate(items)).extracting(RawItemDTO::getSource)
                .containsExactly("Source A", "Source C");
    }

    @Test
    void sourceLimitsCountEachSourceSeparately() {
        properties.setMaxArticlesPerSource(1);
        List<RawItemDTO> items = Arrays.asList(
                raw("A1", STORIES.get(0), "Source A"),
                raw("A2", STORIES.get(1), "Source A"),
                raw("B1", STORIES.get(2), "Source B"),
                raw("U1", STORIES.get(3), null),
                raw("U2", STORIES.get(4), ""));

        assertThat(aggregator.applySourceLimits(items))
                .extracting(RawItemDTO::getTitle).containsExactly("A1", "B1", "U1");
    }

    @Test
    void worksOnStandardizedItemsToo() {
        List<ContentItem> items = Arrays.asList(
                ContentItem.builder().title("Kept").content(STORIES.get(5)).source("bbc").build(),
                ContentItem.builder().title("Short").content("tiny").source("bbc").build());

        List<ContentItem> result = aggregator.aggregate(items);

        assertThat(result).extracting(ContentItem::getTitle).containsExactly("Kept");
    }

    @Test
    void emptyInput() {
        assertThat(aggregator.aggregate(List.<RawItemDTO>of())).isEmpty();
        assertThat(aggregator.aggregate((List<RawItemDTO>) null)).isEmpty();
    }

    private static RawItemDTO raw(String title, String content, String source) {
        return RawItemDTO.builder().title(title).content(content).source(source).build();
    }
}
