package com.factryl.backend.pipeline;

import com.factryl.backend.aggregator.ContentCombiner;
import com.factryl.backend.aggregator.ContentScorer;
import com.factryl.backend.aggregator.Deduplicator;
import com.factryl.backend.aggregator.NewsAggregator;
import com.factryl.backend.config.PipelineProperties;
import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.dto.AggregationRequestDTO;
import com.factryl.backend.model.dto.AggregationResultDTO;
import com.factryl.backend.model.dto.AggregationStatsDTO;
import com.factryl.backend.model.dto.RawItemDTO;
import com.factryl.backend.model.dto.SourceStatisticsDTO;
import com.factryl.backend.model.enums.SortKey;
import com.factryl.backend.registry.SourceCredibility;
import com.factryl.backend.registry.SourceRegistry;
import com.factryl.backend.util.MetadataValues;
import com.factryl.backend.util.TimestampParser;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs combine, deduplicate and score over one batch of collector output.
 * Stateless between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationPipelineService {

    private final ContentCombiner combiner;
    private final Deduplicator deduplicator;
    private final ContentScorer scorer;
    private final NewsAggregator aggregator;
    private final SourceRegistry sourceRegistry;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Full pipeline run with statistics, truncated to the requested number of results.
     */
    public AggregationResultDTO run(AggregationRequestDTO request) {
        long start = System.nanoTime();
        Map<String, List<RawItemDTO>> sources = request.getSources() != null ? request.getSources() : Map.of();
        // null when absent or unrecognised, so the scorer's configured key applies
        SortKey sortBy = SortKey.fromValue(request.getSortBy());
        int maxResults = request.getMaxResults() != null ? request.getMaxResults() : properties.getMaxResults();

        log.info("Running aggregation for query '{}' over {} sources", request.getQuery(), sources.size());

        List<ContentItem> combined = combiner.combine(sources);
        List<ContentItem> unique = deduplicator.deduplicate(combined);
        List<ContentItem> scored = scorer.score(unique, sortBy, request.getQuery());
        List<ContentItem> finalItems = new ArrayList<>(scored.subList(0, Math.min(scored.size(), maxResults)));

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        AggregationStatsDTO stats = AggregationStatsDTO.builder()
                .totalItemsFound(combined.size())
                .uniqueItems(unique.size())
                .duplicatesRemoved(combined.size() - unique.size())
                .finalItems(finalItems.size())
                .sourcesSearched(sources.size())
                .successfulSources((int) finalItems.stream().map(ContentItem::getSource).filter(Objects::nonNull).distinct().count())
                .processingTimeMs(elapsedMs)
                .averageCredibility(averageCredibility(finalItems))
                .build();

        log.info("Aggregation finished: {} found, {} unique, {} returned in {} ms",
                stats.getTotalItemsFound(), stats.getUniqueItems(), stats.getFinalItems(), elapsedMs);

        return AggregationResultDTO.builder()
                .query(request.getQuery())
                .items(finalItems)
                .stats(stats)
                .timestamp(TimestampParser.format(clock.instant()))
                .build();
    }

    public List<RawItemDTO> aggregate(List<RawItemDTO> items) {
        return aggregator.aggregate(items);
    }

    public SourceStatisticsDTO statistics(List<ContentItem> items) {
        return combiner.getSourceStatistics(items);
    }

    public List<String> explain(List<ContentItem> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream().map(scorer::explain).collect(Collectors.toList());
    }

    public Map<String, SourceCredibility> sources() {
        return sourceRegistry.all();
    }

    private double averageCredibility(List<ContentItem> items) {
        if (items.isEmpty()) {
            return 0.0;
        }
        double total = items.stream().mapToDouble(ContentItem::getCredibilityScore).sum();
        return MetadataValues.round(total / items.size(), 3);
    }
}
