package com.factryl.backend.aggregator;

import com.factryl.backend.config.ScorerProperties;
import com.factryl.backend.exception.AggregationConfigException;
import com.factryl.backend.model.content.ContentAnalysis;
import com.factryl.backend.model.content.ContentItem;
import com.factryl.backend.model.content.CredibilityAnalysis;
import com.factryl.backend.model.content.RelevanceAnalysis;
import com.factryl.backend.model.content.ScoreBreakdown;
import com.factryl.backend.model.enums.EngagementFamily;
import com.factryl.backend.model.enums.SortKey;
import com.factryl.backend.util.MetadataValues;
import com.factryl.backend.util.ParsedTimestamp;
import com.factryl.backend.util.TimestampParser;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Scores items on relevance, credibility, recency and engagement and ranks them.
 * <p>
 * The composite is the weighted sum of the four components times the source boost. When an
 * item is about a known entity (query hit, or two terms of one category in the text) relevance
 * weighs more, and entity items with low relevance are penalised. Scoring never fails for a
 * single item: missing or malformed fields fall back to neutral values.
 */
@Service
@Slf4j
public class ContentScorer {

    private static final double NEUTRAL = 0.5;
    private static final double MIN_RECENCY = 0.1;
    private static final int SCORE_PLACES = 3;

    private static final double ENTITY_RELEVANCE_FACTOR = 1.5;
    private static final double ENTITY_CREDIBILITY_FACTOR = 0.8;
    private static final double ENTITY_ENGAGEMENT_FACTOR = 0.7;
    private static final double ENTITY_LOW_RELEVANCE = 0.3;
    private static final double ENTITY_LOW_RELEVANCE_PENALTY = 0.3;
    private static final int ENTITY_MIN_MENTIONS = 2;

    private static final double VERIFIED_BOOST = 1.2;
    private static final double RESEARCH_BOOST = 1.1;
    private static final double CLICKBAIT_PENALTY = 0.8;

    private final ScorerProperties properties;
    private final Clock clock;
    private final Map<String, List<Pattern>> entityPatterns;
    private final Map<String, EngagementFamily> familyBySourceType;

    public ContentScorer(ScorerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        validateWeights(properties);
        this.entityPatterns = compileEntityPatterns(properties.getEntityTypes());
        this.familyBySourceType = indexEngagementTypes(properties.getEngagementTypes());
    }

    public List<ContentItem> score(List<ContentItem> items) {
        return score(items, null, null);
    }

    public List<ContentItem> score(List<ContentItem> items, SortKey sortBy) {
        return score(items, sortBy, null);
    }

    /**
     * Score copies of {@code items} and order them descending by {@code sortBy}.
     * The input items are not modified.
     *
     * @param sortBy sort key, or {@code null} for the configured one
     * @param query  search query for entity detection; falls back to each item's
     *               {@code search_query} metadata when blank
     */
    public List<ContentItem> score(List<ContentItem> items, SortKey sortBy, String query) {
        if (items == null || items.isEmpty()) {
            return new ArrayList<>();
        }
        SortKey key = sortBy != null ? sortBy : defaultSortKey();

        List<ContentItem> scored = new ArrayList<>(items.size());
        for (ContentItem item : items) {
            if (item == null) {
                continue;
            }
            ScoreBreakdown score;
            try {
                score = calculateScore(item, query);
            } catch (RuntimeException e) {
                log.warn("Scoring failed for item {}, using neutral score: {}", item.getId(), e.getMessage());
                score = neutralScore();
            }
            scored.add(copyWithScore(item, score));
        }

        scored.sort(Comparator.comparingDouble((ContentItem item) -> key.extract(item.getScore())).reversed());
        log.info("Scored {} items, sorted by {}", scored.size(), key.getValue());
        return scored;
    }

    public ScoreBreakdown calculateScore(ContentItem item) {
        return calculateScore(item, null);
    }

    public ScoreBreakdown calculateScore(ContentItem item, String query) {
        ContentAnalysis analysis = item.getAnalysis();
        double relevance = relevanceScore(analysis != null ? analysis.getRelevance() : null);
        double credibility = credibilityScore(analysis != null ? analysis.getCredibility() : null);
        // a filled-in date says nothing about age
        double recency = Boolean.TRUE.equals(item.getPublishedDefaulted())
                ? NEUTRAL
                : recencyScore(item.getPublished());
        double engagement = engagementScore(item);

        String entityType = detectEntityType(item, query);
        Weights weights = entityType != null ? entityWeights() : baseWeights();

        double composite = relevance * weights.relevance
                + credibility * weights.credibility
                + recency * weights.recency
                + engagement * weights.engagement;

        double sourceBoost = sourceBoost(item);
        composite *= sourceBoost;

        if (entityType != null && relevance < ENTITY_LOW_RELEVANCE) {
            composite *= ENTITY_LOW_RELEVANCE_PENALTY;
        }

        return ScoreBreakdown.builder()
                .relevance(MetadataValues.round(relevance, SCORE_PLACES))
                .credibility(MetadataValues.round(credibility, SCORE_PLACES))
                .recency(MetadataValues.round(recency, SCORE_PLACES))
                .engagement(MetadataValues.round(engagement, SCORE_PLACES))
                .sourceBoost(MetadataValues.round(sourceBoost, SCORE_PLACES))
                .composite(floorComposite(composite))
                .build();
    }

    /**
     * Analyzer score plus capped boosts for title matches (0.1 each, up to 0.3) and keyword
     * density (twice the density, up to 0.2).
     */
    double relevanceScore(RelevanceAnalysis relevance) {
        if (relevance == null) {
            return NEUTRAL;
        }
        double base = finiteOr(relevance.getScore(), NEUTRAL);
        int titleMatches = relevance.getTitleMatches() != null ? relevance.getTitleMatches().size() : 0;
        double titleBoost = Math.min(titleMatches * 0.1, 0.3);
        double densityBoost = Math.min(finiteOr(relevance.getKeywordDensity(), 0.0) * 2, 0.2);
        return clamp(base + titleBoost + densityBoost);
    }

    /**
     * Analyzer score minus 0.1 per risk factor.
     */
    double credibilityScore(CredibilityAnalysis credibility) {
        if (credibility == null) {
            return NEUTRAL;
        }
        double base = finiteOr(credibility.getScore(), NEUTRAL);
        int riskFactors = credibility.getRiskFactors() != null ? credibility.getRiskFactors().size() : 0;
        return clamp(base - riskFactors * 0.1);
    }

    /**
     * Exponential decay over whole days of age; 0.5 when the date is missing or unparsable.
     */
    double recencyScore(String published) {
        ParsedTimestamp parsed = TimestampParser.parse(published);
        if (!parsed.isValid()) {
            return NEUTRAL;
        }

        long ageDays = Duration.between(parsed.getInstant(), clock.instant()).toDays();
        int maxAgeDays = properties.getMaxAgeDays();
        if (ageDays <= 0) {
            return 1.0;
        }
        if (ageDays >= maxAgeDays) {
            return MIN_RECENCY;
        }
        double decay = maxAgeDays / 3.0;
        return Math.exp(-ageDays / decay);
    }

    double engagementScore(ContentItem item) {
        String sourceType = Objects.toString(item.getSourceType(), "").toLowerCase(Locale.ROOT);
        EngagementFamily family = familyBySourceType.get(sourceType);
        if (family == null) {
            return NEUTRAL;
        }

        Map<String, Object> metadata = item.getMetadata();
        switch (family) {
            case VIDEO: {
                double views = MetadataValues.number(metadata, "views", 0);
                double likes = MetadataValues.number(metadata, "likes", 0);
                double viewScore = logScale(views, 6);
                double likeRatio = views > 0 ? likes / Math.max(views, 1) : 0;
                double likeScore = Math.min(likeRatio * 100, 1.0);
                return clamp(viewScore * 0.7 + likeScore * 0.3);
            }
            case DISCUSSION: {
                double score = MetadataValues.number(metadata, "score", 0);
                double comments = MetadataValues.number(metadata, "comments", 0);
                double upvoteRatio = MetadataValues.number(metadata, "upvote_ratio", NEUTRAL);
                return clamp(logScale(score, 4) * 0.4 + logScale(comments, 3) * 0.3 + upvoteRatio * 0.3);
            }
            case MICROBLOG: {
                double retweets = MetadataValues.number(metadata, "retweets", 0);
                double likes = MetadataValues.number(metadata, "likes", 0);
                double replies = MetadataValues.number(metadata, "replies", 0);
                return clamp(logScale(retweets, 4) * 0.4 + logScale(likes, 4) * 0.4 + logScale(replies, 3) * 0.2);
            }
            case LONG_FORM:
                return wordCountScore(item.getContent());
            default:
                return NEUTRAL;
        }
    }

    /**
     * Configured boost for the source type times content adjustments: verified sources,
     * research vocabulary and clickbait titles.
     */
    double sourceBoost(ContentItem item) {
        String sourceType = Objects.toString(item.getSourceType(), "");
        Double configured = properties.getBoostFactors().get(sourceType);
        double baseBoost = configured != null && Double.isFinite(configured) ? configured : 1.0;

        double additional = 1.0;
        if (MetadataValues.flag(item.getMetadata(), "verified")) {
            additional *= VERIFIED_BOOST;
        }

        String title = Objects.toString(item.getTitle(), "").toLowerCase(Locale.ROOT);
        String text = title + " " + Objects.toString(item.getContent(), "").toLowerCase(Locale.ROOT);
        if (properties.getResearchTerms().stream().anyMatch(term -> text.contains(term.toLowerCase(Locale.ROOT)))) {
            additional *= RESEARCH_BOOST;
        }
        if (properties.getClickbaitTerms().stream().anyMatch(term -> title.contains(term.toLowerCase(Locale.ROOT)))) {
            additional *= CLICKBAIT_PENALTY;
        }

        return baseBoost * additional;
    }

    /**
     * Entity category the item is about, or {@code null}.
     */
    String detectEntityType(ContentItem item, String query) {
        String effectiveQuery = StringUtils.hasText(query)
                ? query
                : MetadataValues.text(item.getMetadata(), "search_query");
        String title = Objects.toString(item.getTitle(), "");
        String content = Objects.toString(item.getContent(), "");

        for (Map.Entry<String, List<Pattern>> entry : entityPatterns.entrySet()) {
            List<Pattern> patterns = entry.getValue();
            if (patterns.stream().anyMatch(p -> p.matcher(effectiveQuery).find())) {
                return entry.getKey();
            }
            long mentions = patterns.stream()
                    .filter(p -> p.matcher(title).find() || p.matcher(content).find())
                    .count();
            if (mentions >= ENTITY_MIN_MENTIONS) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Human-readable summary of an item's score.
     */
    public String explain(ContentItem item) {
        ScoreBreakdown score = item != null ? item.getScore() : null;
        if (score == null) {
            return "No scoring data available";
        }

        List<String> explanations = new ArrayList<>();

        double relevance = score.getRelevance();
        if (relevance >= 0.8) {
            explanations.add("highly relevant");
        } else if (relevance >= 0.6) {
            explanations.add("moderately relevant");
        } else if (relevance >= 0.4) {
            explanations.add("somewhat relevant");
        } else {
            explanations.add("low relevance");
        }

        double credibility = score.getCredibility();
        if (credibility >= 0.8) {
            explanations.add("high credibility");
        } else if (credibility >= 0.6) {
            explanations.add("moderate credibility");
        } else {
            explanations.add("questionable credibility");
        }

        double recency = score.getRecency();
        if (recency >= 0.8) {
            explanations.add("very recent");
        } else if (recency >= 0.6) {
            explanations.add("recent");
        } else if (recency >= 0.4) {
            explanations.add("somewhat dated");
        } else {
            explanations.add("old content");
        }

        double engagement = score.getEngagement();
        if (engagement >= 0.7) {
            explanations.add("high engagement");
        } else if (engagement >= 0.5) {
            explanations.add("moderate engagement");
        }

        return String.format(Locale.ROOT, "Score: %.2f - %s", score.getComposite(), String.join(", ", explanations));
    }

    private double wordCountScore(String content) {
        String text = Objects.toString(content, "").trim();
        int words = text.isEmpty() ? 0 : text.split("\\s+").length;
        if (words >= 800 && words <= 1200) {
            return 1.0;
        }
        if (words < 200) {
            return 0.3;
        }
        if (words > 3000) {
            return 0.6;
        }
        return 0.7;
    }

    private SortKey defaultSortKey() {
        return properties.getSortBy() != null ? properties.getSortBy() : SortKey.COMPOSITE;
    }

    private Weights baseWeights() {
        return new Weights(properties.getRelevanceWeight(), properties.getCredibilityWeight(),
                properties.getRecencyWeight(), properties.getEngagementWeight());
    }

    private Weights entityWeights() {
        double relevance = properties.getRelevanceWeight() * ENTITY_RELEVANCE_FACTOR;
        double credibility = properties.getCredibilityWeight() * ENTITY_CREDIBILITY_FACTOR;
        double recency = properties.getRecencyWeight();
        double engagement = properties.getEngagementWeight() * ENTITY_ENGAGEMENT_FACTOR;
        double total = relevance + credibility + recency + engagement;
        return new Weights(relevance / total, credibility / total, recency / total, engagement / total);
    }

    private double floorComposite(double composite) {
        double minScore = properties.getMinScore();
        if (!Double.isFinite(composite)) {
            return minScore;
        }
        return Math.max(MetadataValues.round(Math.max(composite, minScore), SCORE_PLACES), minScore);
    }

    private ScoreBreakdown neutralScore() {
        return ScoreBreakdown.builder()
                .relevance(NEUTRAL)
                .credibility(NEUTRAL)
                .recency(NEUTRAL)
                .engagement(NEUTRAL)
                .sourceBoost(1.0)
                .composite(properties.getMinScore())
                .build();
    }

    private ContentItem copyWithScore(ContentItem item, ScoreBreakdown score) {
        return item.toBuilder()
                .tags(item.getTags() != null ? new LinkedHashSet<>(item.getTags()) : new LinkedHashSet<>())
                .duplicateSources(item.getDuplicateSources() != null
                        ? new ArrayList<>(item.getDuplicateSources())
                        : new ArrayList<>())
                .metadata(item.getMetadata() != null ? new LinkedHashMap<>(item.getMetadata()) : new LinkedHashMap<>())
                .score(score)
                .build();
    }

    private static double logScale(double value, double decades) {
        return Math.min(Math.log10(Math.max(value, 1)) / decades, 1.0);
    }

    private static double finiteOr(Double value, double fallback) {
        return value != null && Double.isFinite(value) ? value : fallback;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void validateWeights(ScorerProperties properties) {
        double[] weights = {properties.getRelevanceWeight(), properties.getCredibilityWeight(),
                properties.getRecencyWeight(), properties.getEngagementWeight()};
        double total = 0;
        for (double weight : weights) {
            if (weight < 0 || !Double.isFinite(weight)) {
                throw new AggregationConfigException("Scoring weights must be finite and non-negative");
            }
            total += weight;
        }
        if (total <= 0) {
            throw new AggregationConfigException("At least one scoring weight must be positive");
        }
    }

    private static Map<String, List<Pattern>> compileEntityPatterns(Map<String, List<String>> entityTypes) {
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        if (entityTypes == null) {
            return patterns;
        }
        entityTypes.forEach((category, terms) -> {
            List<Pattern> compiled = new ArrayList<>();
            if (terms != null) {
                for (String term : terms) {
                    if (StringUtils.hasText(term)) {
                        compiled.add(Pattern.compile("\\b" + Pattern.quote(term.trim()) + "\\b",
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
                    }
                }
            }
            patterns.put(category, compiled);
        });
        return patterns;
    }

    private static Map<String, EngagementFamily> indexEngagementTypes(Map<EngagementFamily, List<String>> types) {
        Map<String, EngagementFamily> index = new HashMap<>();
        if (types == null) {
            return index;
        }
        types.forEach((family, sourceTypes) -> {
            if (sourceTypes != null) {
                sourceTypes.stream()
                        .filter(StringUtils::hasText)
                        .forEach(type -> index.put(type.trim().toLowerCase(Locale.ROOT), family));
            }
        });
        return index;
    }

    private static final class Weights {
        private final double relevance;
        private final double credibility;
        private final double recency;
        private final double engagement;

        private Weights(double relevance, double credibility, double recency, double engagement) {
            this.relevance = relevance;
            this.credibility = credibility;
            this.recency = recency;
            this.engagement = engagement;
        }
    }
}
