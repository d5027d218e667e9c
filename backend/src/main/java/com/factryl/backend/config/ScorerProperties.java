package com.factryl.backend.config;

import com.factryl.backend.model.enums.EngagementFamily;
import com.factryl.backend.model.enums.SortKey;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Weights, decay and boost settings for the content scorer.
 */
@Component
@ConfigurationProperties(prefix = "factryl.scorer")
@Validated
@Data
public class ScorerProperties {

    @DecimalMin("0.0")
    private double minScore = 0.1;

    @DecimalMin("0.0")
    private double relevanceWeight = 0.4;
    @DecimalMin("0.0")
    private double credibilityWeight = 0.2;
    @DecimalMin("0.0")
    private double recencyWeight = 0.2;
    @DecimalMin("0.0")
    private double engagementWeight = 0.2;

    private SortKey sortBy = SortKey.COMPOSITE;

    // Age at which recency bottoms out at 0.1; the decay constant is a third of it
    @Min(1)
    private int maxAgeDays = 30;

    // Multiplier per source type, 1.0 when absent
    private Map<String, Double> boostFactors = new LinkedHashMap<>();

    // Entity category -> terms that signal an entity-focused item
    private Map<String, List<String>> entityTypes = defaultEntityTypes();

    private List<String> researchTerms = new ArrayList<>(
            Arrays.asList("research", "study", "analysis", "peer-reviewed"));

    private List<String> clickbaitTerms = new ArrayList<>(
            Arrays.asList("click here", "you won't believe", "shocking"));

    private Map<EngagementFamily, List<String>> engagementTypes = defaultEngagementTypes();

    private static Map<String, List<String>> defaultEntityTypes() {
        Map<String, List<String>> types = new LinkedHashMap<>();
        types.put("k-pop", new ArrayList<>(Arrays.asList("bts", "blackpink", "twice", "exo", "nct", "iu", "psy")));
        types.put("tech", new ArrayList<>(Arrays.asList("apple", "google", "microsoft", "meta", "amazon")));
        types.put("sports", new ArrayList<>(Arrays.asList("nba", "nfl", "mlb", "fifa", "uefa")));
        return types;
    }

    private static Map<EngagementFamily, List<String>> defaultEngagementTypes() {
        Map<EngagementFamily, List<String>> types = new EnumMap<>(EngagementFamily.class);
        types.put(EngagementFamily.VIDEO, new ArrayList<>(List.of("youtube")));
        types.put(EngagementFamily.DISCUSSION, new ArrayList<>(List.of("reddit")));
        types.put(EngagementFamily.MICROBLOG, new ArrayList<>(List.of("twitter")));
        types.put(EngagementFamily.LONG_FORM, new ArrayList<>(List.of("news")));
        return types;
    }
}
