package io.tagprofile.core.engine;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.model.DimensionSummary;
import io.tagprofile.core.model.TagInstance;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the per-bucket summaries and the profile maturity from scratch. Maturity rewards
 * the share of confident tags and the number of tags, the latter saturating at
 * {@code maturityTagTarget}.
 */
public final class MetricsCalculator {
    private final EngineConfig config;

    public MetricsCalculator(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ProfileMetrics calculate(Map<String, Map<String, List<TagInstance>>> dimensions) {
        List<DimensionSummary> summaries = new ArrayList<>();
        int totalTags = 0;
        int confidentTags = 0;

        for (Map.Entry<String, Map<String, List<TagInstance>>> dimension : dimensions.entrySet()) {
            for (Map.Entry<String, List<TagInstance>> bucket : dimension.getValue().entrySet()) {
                List<TagInstance> tags = bucket.getValue();
                if (tags.isEmpty()) {
                    continue;
                }
                TagInstance dominant = ExclusivityResolver.strongest(tags).orElseThrow();
                summaries.add(new DimensionSummary(
                    dimension.getKey(),
                    bucket.getKey(),
                    dominant.tagName(),
                    dominant.confidence(),
                    tags.size(),
                    dominant.lastReinforced()
                ));
                totalTags += tags.size();
                confidentTags += (int) tags.stream().filter(tag -> tag.confidence() >= config.confidentThreshold()).count();
            }
        }

        return new ProfileMetrics(summaries, totalTags, confidentTags, maturity(totalTags, confidentTags));
    }

    public double maturity(int totalTags, int confidentTags) {
        if (totalTags == 0) {
            return 0.0;
        }
        double quality = (double) confidentTags / totalTags;
        double quantity = (double) totalTags / config.maturityTagTarget();
        return Math.min(1.0, quality * quantity);
    }
}
