package io.tagprofile.core.engine;

import io.tagprofile.core.model.TagInstance;
import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.model.UserProfile;
import io.tagprofile.core.taxonomy.TagTaxonomy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the in-memory part of one update cycle: reinforce every observation of a known
 * category, decay the whole profile, rebuild the metrics. Persisting the result and
 * recording the timeline event are left to the caller. Every call counts as one interaction,
 * including an empty batch.
 */
public final class UpdateOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(UpdateOrchestrator.class);

    private final TagTaxonomy taxonomy;
    private final ReinforcementEngine reinforcementEngine;
    private final DecayEngine decayEngine;
    private final MetricsCalculator metricsCalculator;
    private final Clock clock;

    public UpdateOrchestrator(
        TagTaxonomy taxonomy,
        ReinforcementEngine reinforcementEngine,
        DecayEngine decayEngine,
        MetricsCalculator metricsCalculator,
        Clock clock
    ) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy must not be null");
        this.reinforcementEngine = Objects.requireNonNull(reinforcementEngine, "reinforcementEngine must not be null");
        this.decayEngine = Objects.requireNonNull(decayEngine, "decayEngine must not be null");
        this.metricsCalculator = Objects.requireNonNull(metricsCalculator, "metricsCalculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public UserProfile apply(UserProfile profile, Map<String, List<TagObservation>> observationsByCategory) {
        Objects.requireNonNull(profile, "profile must not be null");
        Instant now = clock.instant();
        String nowText = Timestamps.format(now);
        Map<String, Map<String, List<TagInstance>>> dimensions = profile.mutableDimensions();

        if (observationsByCategory != null) {
            for (Map.Entry<String, List<TagObservation>> entry : observationsByCategory.entrySet()) {
                String category = entry.getKey();
                if (!taxonomy.isKnownCategory(category)) {
                    LOG.debug("Ignoring observations for unknown category {}", category);
                    continue;
                }
                if (entry.getValue() == null) {
                    continue;
                }
                for (TagObservation observation : entry.getValue()) {
                    if (observation == null) {
                        continue;
                    }
                    TagObservation stamped = observation.timestamp().isBlank()
                        ? observation.withTimestamp(nowText)
                        : observation;
                    reinforcementEngine.apply(dimensions, category, stamped);
                }
            }
        }

        decayEngine.apply(dimensions, now);
        ProfileMetrics metrics = metricsCalculator.calculate(dimensions);

        return new UserProfile(
            profile.userId(),
            profile.createdAt(),
            now,
            dimensions,
            metrics.maturity(),
            profile.totalInteractions() + 1,
            metrics.summaries()
        );
    }
}
