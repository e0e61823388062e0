package io.tagprofile.core.engine;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.model.TagInstance;
import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.taxonomy.TagTaxonomy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges one observation into a profile's tag dimensions: an instance with the same name in
 * the same bucket is reinforced, otherwise a new instance is inserted (after exclusivity
 * resolution for exclusive sub-dimensions).
 */
public final class ReinforcementEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ReinforcementEngine.class);

    private final EngineConfig config;
    private final TagTaxonomy taxonomy;
    private final ExclusivityResolver exclusivityResolver;

    public ReinforcementEngine(EngineConfig config, TagTaxonomy taxonomy, ExclusivityResolver exclusivityResolver) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy must not be null");
        this.exclusivityResolver = Objects.requireNonNull(exclusivityResolver, "exclusivityResolver must not be null");
    }

    public void apply(Map<String, Map<String, List<TagInstance>>> dimensions, String category, TagObservation observation) {
        String subcategory = observation.subcategory();
        List<TagInstance> bucket = dimensions
            .computeIfAbsent(category, key -> new LinkedHashMap<>())
            .computeIfAbsent(subcategory, key -> new ArrayList<>());

        for (int i = 0; i < bucket.size(); i++) {
            TagInstance existing = bucket.get(i);
            if (existing.tagName().equals(observation.name())) {
                TagInstance reinforced = reinforce(existing, observation);
                bucket.set(i, reinforced);
                LOG.debug("Reinforced tag {}/{}/{} (confidence {})", category, subcategory, observation.name(), reinforced.confidence());
                return;
            }
        }

        boolean exclusive = taxonomy.isExclusive(category, subcategory);
        if (exclusive) {
            exclusivityResolver.resolve(bucket, observation);
        }
        bucket.add(create(observation));
        LOG.debug("Added tag {}/{}/{} (confidence {})", category, subcategory, observation.name(), observation.confidence());
        if (exclusive && config.strictExclusivity()) {
            exclusivityResolver.prune(bucket);
        }
    }

    /**
     * Pulls the existing confidence toward the observed one by the fixed reinforcement weight,
     * independent of how often the tag was reinforced before.
     */
    public TagInstance reinforce(TagInstance existing, TagObservation observation) {
        double weight = config.reinforcementWeight();
        double confidence = existing.confidence() * (1 - weight) + observation.confidence() * weight;

        List<String> evidence = new ArrayList<>(existing.evidenceList());
        evidence.add(observation.evidence());
        if (evidence.size() > config.maxEvidence()) {
            evidence = new ArrayList<>(evidence.subList(evidence.size() - config.maxEvidence(), evidence.size()));
        }

        return new TagInstance(
            existing.tagName(),
            config.clampConfidence(confidence),
            existing.reinforcementCount() + 1,
            existing.firstSeen(),
            observation.timestamp(),
            evidence,
            existing.decayRate()
        );
    }

    public TagInstance create(TagObservation observation) {
        return new TagInstance(
            observation.name(),
            config.clampConfidence(observation.confidence()),
            1,
            observation.timestamp(),
            observation.timestamp(),
            List.of(observation.evidence()),
            config.defaultDecayRate()
        );
    }
}
