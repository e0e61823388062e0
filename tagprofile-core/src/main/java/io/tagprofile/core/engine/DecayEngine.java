package io.tagprofile.core.engine;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.model.TagInstance;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the confidence of every instance from the time since its last reinforcement:
 *
 * <pre>
 * decay_factor    = max(minDecayFactor, 1 - days_since * decay_rate / decayWindowDays)
 * base_confidence = confidence / (1 + reinforcement_count * reinforcementDamping)
 * confidence'     = max(minConfidence, base_confidence * decay_factor)
 * </pre>
 *
 * The division by the reinforcement term is applied on every pass, so it compounds across
 * cycles. Instances whose last reinforcement cannot be parsed keep their confidence.
 */
public final class DecayEngine {
    private static final Logger LOG = LoggerFactory.getLogger(DecayEngine.class);

    private final EngineConfig config;
    private final ZoneId zone;

    public DecayEngine(EngineConfig config, ZoneId zone) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public void apply(Map<String, Map<String, List<TagInstance>>> dimensions, Instant now) {
        for (Map<String, List<TagInstance>> buckets : dimensions.values()) {
            for (List<TagInstance> bucket : buckets.values()) {
                bucket.replaceAll(instance -> decay(instance, now));
            }
        }
    }

    public TagInstance decay(TagInstance instance, Instant now) {
        Optional<Instant> lastReinforced = Timestamps.parse(instance.lastReinforced(), zone);
        if (lastReinforced.isEmpty()) {
            LOG.warn("Skipping decay for tag {}: unparseable last_reinforced '{}'", instance.tagName(), instance.lastReinforced());
            return instance;
        }
        // future timestamps (clock skew) count as reinforced today
        long daysSince = Math.max(0, Timestamps.daysBetween(lastReinforced.get(), now));
        return instance.withConfidence(decayedConfidence(
            instance.confidence(),
            instance.reinforcementCount(),
            instance.decayRate(),
            daysSince
        ));
    }

    public double decayedConfidence(double confidence, int reinforcementCount, double decayRate, long daysSince) {
        double decayFactor = Math.max(config.minDecayFactor(), 1.0 - (daysSince * decayRate / config.decayWindowDays()));
        double baseConfidence = confidence / (1 + reinforcementCount * config.reinforcementDamping());
        return Math.min(config.maxConfidence(), Math.max(config.minConfidence(), baseConfidence * decayFactor));
    }
}
