package com.factryl.backend.aggregator;

import com.factryl.backend.config.AggregatorProperties;
import com.factryl.backend.model.ContentRecord;
import com.factryl.backend.util.SequenceMatcher;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Lightweight filter, deduplicate and cap pass over a flat list of items that need not be
 * standardized. Works on raw or standardized records and returns the same type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsAggregator {

    private static final String UNKNOWN_SOURCE = "unknown";

    private final AggregatorProperties properties;

    /**
     * Filter short items, drop content duplicates, then cap items per source.
     */
    public <T extends ContentRecord> List<T> aggregate(List<T> items) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }
        List<T> filtered = filterContent(items);
        List<T> unique = deduplicate(filtered);
        List<T> limited = applySourceLimits(unique);
        log.info("Aggregated {} items: {} after length filter, {} after dedup, {} after source limits",
                items.size(), filtered.size(), unique.size(), limited.size());
        return limited;
    }

    /**
     * Keep items whose content has at least the configured minimum number of code points.
     */
    public <T extends ContentRecord> List<T> filterContent(List<T> items) {
        List<T> filtered = new ArrayList<>();
        for (T item : items) {
            if (item == null) {
                continue;
            }
            String content = Objects.toString(item.getContent(), "");
            int length = content.codePointCount(0, content.length());
            if (length >= properties.getMinArticleLength()) {
                filtered.add(item);
            } else {
                log.debug("Filtered short item '{}' ({} chars)", item.getTitle(), length);
            }
        }
        return filtered;
    }

    /**
     * Drop items whose raw content is at least as similar as the deduplication threshold to an
     * item already kept.
     */
    public <T extends ContentRecord> List<T> deduplicate(List<T> items) {
        List<T> unique = new ArrayList<>();
        for (T item : items) {
            String content = Objects.toString(item.getContent(), "");
            boolean duplicate = false;
            for (T existing : unique) {
                double similarity = SequenceMatcher.ratio(content, Objects.toString(existing.getContent(), ""));
                if (similarity >= properties.getDeduplicationThreshold()) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                unique.add(item);
            }
        }
        return unique;
    }

    /**
     * Keep the first N items of every source in input order.
     */
    public <T extends ContentRecord> List<T> applySourceLimits(List<T> items) {
        Map<String, Integer> sourceCounts = new HashMap<>();
        List<T> limited = new ArrayList<>();
        for (T item : items) {
            String source = StringUtils.hasText(item.getSource()) ? item.getSource() : UNKNOWN_SOURCE;
            int count = sourceCounts.getOrDefault(source, 0);
            if (count < properties.getMaxArticlesPerSource()) {
                limited.add(item);
                sourceCounts.put(source, count + 1);
            }
        }
        return limited;
    }
}
