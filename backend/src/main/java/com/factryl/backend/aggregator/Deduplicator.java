package com.factryl.backend.aggregator;

import com.factryl.backend.config.DeduplicatorProperties;
import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.content.DuplicateSource;
import com.factryl.backend.util.SequenceMatcher;
import com.factryl.backend.util.TextNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Removes exact and near-duplicate items, keeping the first occurrence of each cluster.
 * <p>
 * Exact duplicates are dropped by a hash of normalized title, content prefix and URL. The
 * remaining items are compared against every item already kept: a URL similarity at or above
 * the URL threshold is a duplicate outright, otherwise a weighted title/content/URL similarity
 * is tested against the overall threshold. The first kept item that matches absorbs the
 * duplicate's tags and provenance.
 * <p>
 * The scan is quadratic in the number of kept items. Blocking by normalized domain would cut
 * it down without changing which item wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Deduplicator {

    private static final int HASH_CONTENT_PREFIX = 200;

    private static final double TITLE_WEIGHT = 0.4;
    private static final double CONTENT_WEIGHT = 0.4;
    private static final double URL_WEIGHT = 0.2;

    private static final double PATH_WEIGHT = 0.8;
    private static final double QUERY_WEIGHT = 0.2;

    private final DeduplicatorProperties properties;

    public List<ContentItem> deduplicate(List<ContentItem> items) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }

        // Pass 1: exact duplicates by normalized hash
        Set<String> seenHashes = new HashSet<>();
        List<ContentItem> candidates = new ArrayList<>();
        for (ContentItem item : items) {
            if (item == null) {
                continue;
            }
            if (seenHashes.add(contentHash(item))) {
                candidates.add(item);
            } else {
                log.debug("Dropping exact duplicate {}", item.getId());
            }
        }

        // Pass 2: similarity against items already kept, first match wins
        List<ContentItem> unique = new ArrayList<>();
        for (ContentItem item : candidates) {
            ContentItem match = null;
            try {
                match = findFirstSimilar(item, unique);
            } catch (RuntimeException e) {
                log.warn("Similarity check failed for item {}, keeping it: {}", item.getId(), e.getMessage());
            }

            if (match != null) {
                log.debug("Merging near duplicate {} into {}", item.getId(), match.getId());
                mergeDuplicate(match, item);
            } else {
                unique.add(item);
            }
        }

        log.info("Deduplicated {} items to {} ({} exact, {} near duplicates)",
                items.size(), unique.size(), items.size() - candidates.size(), candidates.size() - unique.size());
        return unique;
    }

    /**
     * Whether {@code item} duplicates {@code existing}.
     */
    public boolean areSimilar(ContentItem item, ContentItem existing) {
        double urlSimilarity = urlSimilarity(item.getUrl(), existing.getUrl());
        if (urlSimilarity >= properties.getUrlThreshold()) {
            return true;
        }

        double titleSimilarity = textSimilarity(item.getTitle(), existing.getTitle());
        double contentSimilarity = textSimilarity(item.getContent(), existing.getContent());

        double overall = titleSimilarity * TITLE_WEIGHT
                + contentSimilarity * CONTENT_WEIGHT
                + urlSimilarity * URL_WEIGHT;
        return overall >= properties.getSimilarityThreshold();
    }

    /**
     * Sequence ratio of the normalized texts; 0 when either side is empty.
     */
    public static double textSimilarity(String text1, String text2) {
        if (text1 == null || text1.isEmpty() || text2 == null || text2.isEmpty()) {
            return 0.0;
        }
        String norm1 = TextNormalizer.normalizeText(text1);
        String norm2 = TextNormalizer.normalizeText(text2);
        if (norm1.isEmpty() || norm2.isEmpty()) {
            return 0.0;
        }
        return SequenceMatcher.ratio(norm1, norm2);
    }

    /**
     * 1.0 for equal normalized URLs, 0.0 across hosts, otherwise weighted path and query similarity.
     */
    public static double urlSimilarity(String url1, String url2) {
        if (url1 == null || url1.isEmpty() || url2 == null || url2.isEmpty()) {
            return 0.0;
        }
        String norm1 = TextNormalizer.normalizeUrl(url1);
        String norm2 = TextNormalizer.normalizeUrl(url2);
        if (norm1.equals(norm2)) {
            return 1.0;
        }

        try {
            UriComponents uri1 = UriComponentsBuilder.fromUriString(norm1).build();
            UriComponents uri2 = UriComponentsBuilder.fromUriString(norm2).build();

            if (!sameAuthority(uri1, uri2)) {
                return 0.0;
            }

            double pathSimilarity = SequenceMatcher.ratio(
                    Objects.toString(uri1.getPath(), ""), Objects.toString(uri2.getPath(), ""));
            double querySimilarity = SequenceMatcher.ratio(
                    Objects.toString(uri1.getQuery(), ""), Objects.toString(uri2.getQuery(), ""));
            return pathSimilarity * PATH_WEIGHT + querySimilarity * QUERY_WEIGHT;

        } catch (IllegalArgumentException e) {
            // unsplittable or bad port: only comparable when the text before the path agrees
            return Objects.equals(authorityText(norm1), authorityText(norm2))
                    ? SequenceMatcher.ratio(norm1, norm2)
                    : 0.0;
        }
    }

    private ContentItem findFirstSimilar(ContentItem item, List<ContentItem> unique) {
        for (ContentItem existing : unique) {
            if (areSimilar(item, existing)) {
                return existing;
            }
        }
        return null;
    }

    private static boolean sameAuthority(UriComponents uri1, UriComponents uri2) {
        return Objects.equals(uri1.getUserInfo(), uri2.getUserInfo())
                && Objects.equals(uri1.getHost(), uri2.getHost())
                && uri1.getPort() == uri2.getPort();
    }

    private static String authorityText(String url) {
        int start = url.indexOf("://");
        String rest = start >= 0 ? url.substring(start + 3) : "";
        int end = 0;
        while (end < rest.length() && "/?#".indexOf(rest.charAt(end)) < 0) {
            end++;
        }
        return rest.substring(0, end);
    }

    private String contentHash(ContentItem item) {
        String title = TextNormalizer.normalizeText(item.getTitle());
        String content = prefix(TextNormalizer.normalizeText(item.getContent()), HASH_CONTENT_PREFIX);
        String url = TextNormalizer.normalizeUrl(item.getUrl());
        return TextNormalizer.md5Hex(title + "|" + content + "|" + url);
    }

    private void mergeDuplicate(ContentItem existing, ContentItem duplicate) {
        Set<String> tags = existing.getTags() != null ? new LinkedHashSet<>(existing.getTags()) : new LinkedHashSet<>();
        if (duplicate.getTags() != null) {
            tags.addAll(duplicate.getTags());
        }
        existing.setTags(tags);

        List<DuplicateSource> duplicates = existing.getDuplicateSources() != null
                ? new ArrayList<>(existing.getDuplicateSources())
                : new ArrayList<>();
        duplicates.add(new DuplicateSource(duplicate.getSourceType(), duplicate.getUrl(), duplicate.getId()));
        existing.setDuplicateSources(duplicates);
    }

    private static String prefix(String text, int codePoints) {
        if (text.codePointCount(0, text.length()) <= codePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, codePoints));
    }
}
