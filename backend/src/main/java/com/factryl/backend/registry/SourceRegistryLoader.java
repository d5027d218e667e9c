package com.factryl.backend.registry;

import com.factryl.backend.exception.AggregationConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads the source credibility table from YAML.
 * <p>
 * The file declares the scale its scores are written in: {@code unit} (0-1, the default) or
 * {@code percent} (0-100, divided by 100 here). Scores outside the declared scale are rejected.
 */
@Component
@Slf4j
public class SourceRegistryLoader {

    private static final String SCALE_UNIT = "unit";
    private static final String SCALE_PERCENT = "percent";

    public SourceRegistry load(Resource resource) {
        try (InputStream inputStream = resource.getInputStream()) {
            Yaml yaml = new Yaml();
            Map<String, Object> data = yaml.load(inputStream);
            if (data == null) {
                throw new AggregationConfigException("Source registry is empty: " + resource.getDescription());
            }

            String scale = String.valueOf(data.getOrDefault("scale", SCALE_UNIT)).toLowerCase(Locale.ROOT);
            double divisor = scaleDivisor(scale);

            SourceCredibility fallback = SourceCredibility.UNKNOWN;
            Object defaultEntry = data.get("default");
            if (defaultEntry instanceof Map) {
                fallback = toCredibility("default", asMap(defaultEntry), divisor, SourceCredibility.UNKNOWN);
            }

            Map<String, SourceCredibility> sources = new LinkedHashMap<>();
            Object sourceEntries = data.get("sources");
            if (sourceEntries instanceof Map) {
                for (Map.Entry<String, Object> entry : asMap(sourceEntries).entrySet()) {
                    sources.put(entry.getKey(), toCredibility(entry.getKey(), asMap(entry.getValue()), divisor, fallback));
                }
            }

            log.info("Loaded {} source credibility records ({} scale) from {}",
                    sources.size(), scale, resource.getDescription());
            return new SourceRegistry(sources, fallback);

        } catch (IOException e) {
            log.error("Error reading source registry {}", resource.getDescription(), e);
            throw new AggregationConfigException("Failed to load source registry: " + resource.getDescription(), e);
        } catch (ClassCastException e) {
            throw new AggregationConfigException("Malformed source registry: " + resource.getDescription(), e);
        }
    }

    private double scaleDivisor(String scale) {
        switch (scale) {
            case SCALE_UNIT:
                return 1.0;
            case SCALE_PERCENT:
                return 100.0;
            default:
                throw new AggregationConfigException("Unknown credibility scale '" + scale + "', expected unit or percent");
        }
    }

    private SourceCredibility toCredibility(String name, Map<String, Object> entry, double divisor,
                                            SourceCredibility defaults) {
        if (entry == null) {
            throw new AggregationConfigException("Source '" + name + "' has no credibility record");
        }
        Object rawScore = entry.get("score");
        if (!(rawScore instanceof Number)) {
            throw new AggregationConfigException("Source '" + name + "' is missing a numeric score");
        }
        double score = ((Number) rawScore).doubleValue();
        if (score < 0 || score > divisor) {
            throw new AggregationConfigException(String.format(Locale.ROOT,
                    "Source '%s' score %s is outside the declared scale [0, %s]", name, score, divisor));
        }

        return SourceCredibility.builder()
                .score(score / divisor)
                .bias(stringOr(entry.get("bias"), defaults.getBias()))
                .category(stringOr(entry.get("category"), defaults.getCategory()))
                .type(stringOr(entry.get("type"), defaults.getType()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private String stringOr(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }
}
