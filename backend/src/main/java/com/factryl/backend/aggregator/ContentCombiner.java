package com.factryl.backend.aggregator;

import com.factryl.backend.config.CombinerProperties;
import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.dto.RawItemDTO;
import com.factryl.backend.model.dto.SourceStatisticsDTO;
import com.factryl.backend.registry.SourceCredibility;
import com.factryl.backend.registry.SourceRegistry;
import com.factryl.backend.util.MetadataValues;
import com.factryl.backend.util.TextNormalizer;
import com.factryl.backend.util.TimestampParser;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Merges per-source collector output into one list of standardized items.
 * <p>
 * Each source is capped before standardization; the merged list is pre-sorted newest first,
 * then by the caller's relevance hint. Unparsable timestamps sort last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentCombiner {

    private static final Comparator<Keyed> NEWEST_FIRST = Comparator
            .comparing((Keyed keyed) -> keyed.published)
            .thenComparingDouble(keyed -> keyed.relevanceHint)
            .reversed();

    private final SourceRegistry sourceRegistry;
    private final CombinerProperties properties;
    private final Clock clock;

    public List<ContentItem> combine(Map<String, List<RawItemDTO>> sourceData) {
        return combine(sourceData, properties.getMaxItemsPerSource());
    }

    /**
     * Standardize and merge items from every source, keeping at most {@code maxPerSource}
     * per source in their original order.
     */
    public List<ContentItem> combine(Map<String, List<RawItemDTO>> sourceData, int maxPerSource) {
        if (sourceData == null || sourceData.isEmpty()) {
            return new ArrayList<>();
        }

        int cap = Math.max(maxPerSource, 0);
        List<Keyed> combined = new ArrayList<>();

        for (Map.Entry<String, List<RawItemDTO>> entry : sourceData.entrySet()) {
            String sourceName = entry.getKey();
            List<RawItemDTO> items = entry.getValue() != null ? entry.getValue() : List.of();
            SourceCredibility credibility = sourceRegistry.lookup(sourceName);

            List<RawItemDTO> limited = items.subList(0, Math.min(items.size(), cap));
            if (limited.size() < items.size()) {
                log.debug("Capped source {} from {} to {} items", sourceName, items.size(), limited.size());
            }

            for (RawItemDTO raw : limited) {
                if (raw == null) {
                    log.warn("Skipping empty item from source {}", sourceName);
                    continue;
                }
                try {
                    ContentItem item = standardize(raw, sourceName, credibility);
                    combined.add(new Keyed(item));
                } catch (RuntimeException e) {
                    log.warn("Skipping item {} from source {}: {}", raw.getUrl(), sourceName, e.getMessage());
                }
            }
        }

        combined.sort(NEWEST_FIRST);

        List<ContentItem> result = new ArrayList<>(combined.size());
        for (Keyed keyed : combined) {
            result.add(keyed.item);
        }
        log.info("Combined {} items from {} sources", result.size(), sourceData.size());
        return result;
    }

    /**
     * Convert one raw item into the canonical shape, freezing the source's credibility metadata.
     */
    public ContentItem standardize(RawItemDTO raw, String source, SourceCredibility credibility) {
        String title = Objects.toString(raw.getTitle(), "");
        String content = Objects.toString(raw.getContent(), "");
        String url = Objects.toString(raw.getUrl(), "");

        String id = StringUtils.hasText(raw.getId()) ? raw.getId() : generateId(source, title, content, url);
        boolean hasPublished = StringUtils.hasText(raw.getPublished());
        String published = hasPublished ? raw.getPublished() : TimestampParser.format(clock.instant());

        Set<String> tags = new LinkedHashSet<>();
        if (raw.getTags() != null) {
            raw.getTags().stream().filter(Objects::nonNull).forEach(tags::add);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (properties.isPreserveSourceMetadata()) {
            if (raw.getMetadata() != null) {
                metadata.putAll(raw.getMetadata());
            }
            if (raw.getExtraFields() != null) {
                metadata.putAll(raw.getExtraFields());
            }
        }

        return ContentItem.builder()
                .id(id)
                .title(title)
                .content(content)
                .url(url)
                .author(Objects.toString(raw.getAuthor(), ""))
                .source(source)
                .sourceType(credibility.getType())
                .sourceCategory(credibility.getCategory())
                .credibilityScore(credibility.getScore())
                .biasRating(credibility.getBias())
                .published(published)
                .publishedDefaulted(hasPublished ? null : Boolean.TRUE)
                .tags(tags)
                .metadata(metadata)
                .relevanceScore(raw.getRelevanceScore())
                .analysis(raw.getAnalysis())
                .build();
    }

    /**
     * Deterministic id for items that arrive without one.
     */
    public static String generateId(String source, String title, String content, String url) {
        return source + "_" + TextNormalizer.md5Hex(title + content + url);
    }

    /**
     * Item counts and shares per source type.
     */
    public SourceStatisticsDTO getSourceStatistics(List<ContentItem> items) {
        if (items == null || items.isEmpty()) {
            return new SourceStatisticsDTO(0, new LinkedHashMap<>(), new LinkedHashMap<>(), 0);
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ContentItem item : items) {
            String type = StringUtils.hasText(item.getSourceType()) ? item.getSourceType() : "unknown";
            counts.merge(type, 1, Integer::sum);
        }

        int total = items.size();
        Map<String, Double> percentages = new LinkedHashMap<>();
        counts.forEach((type, count) -> percentages.put(type, MetadataValues.round(count * 100.0 / total, 1)));

        return new SourceStatisticsDTO(total, counts, percentages, counts.size());
    }

    private static final class Keyed {
        private final ContentItem item;
        private final Instant published;
        private final double relevanceHint;

        private Keyed(ContentItem item) {
            this.item = item;
            this.published = TimestampParser.parse(item.getPublished()).getInstant();
            this.relevanceHint = item.getRelevanceScore() != null ? item.getRelevanceScore() : 0.0;
        }
    }
}
