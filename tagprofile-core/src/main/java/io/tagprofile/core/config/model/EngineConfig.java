package io.tagprofile.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Numeric constants of the profile lifecycle engine. The defaults are the production values;
 * changing them changes long-run confidence and maturity numbers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonAlias({"reinforcement_weight"}) double reinforcementWeight,
    @JsonAlias({"max_evidence"}) int maxEvidence,
    @JsonAlias({"default_decay_rate"}) double defaultDecayRate,
    @JsonAlias({"decay_window_days"}) double decayWindowDays,
    @JsonAlias({"min_decay_factor"}) double minDecayFactor,
    @JsonAlias({"min_confidence"}) double minConfidence,
    @JsonAlias({"max_confidence"}) double maxConfidence,
    @JsonAlias({"reinforcement_damping"}) double reinforcementDamping,
    @JsonAlias({"confident_threshold"}) double confidentThreshold,
    @JsonAlias({"maturity_tag_target"}) int maturityTagTarget,
    @JsonAlias({"timeline_limit"}) int timelineLimit,
    @JsonAlias({"strict_exclusivity"}) boolean strictExclusivity
) {

    public EngineConfig {
        requireRange("reinforcementWeight", reinforcementWeight, 0.0, 1.0);
        requireRange("minDecayFactor", minDecayFactor, 0.0, 1.0);
        requireRange("minConfidence", minConfidence, 0.0, 1.0);
        requireRange("maxConfidence", maxConfidence, minConfidence, 1.0);
        requireRange("confidentThreshold", confidentThreshold, 0.0, 1.0);
        if (maxEvidence < 1) {
            throw new IllegalArgumentException("maxEvidence must be >= 1");
        }
        if (!(decayWindowDays > 0)) {
            throw new IllegalArgumentException("decayWindowDays must be > 0");
        }
        if (defaultDecayRate < 0 || reinforcementDamping < 0) {
            throw new IllegalArgumentException("defaultDecayRate and reinforcementDamping must be >= 0");
        }
        if (maturityTagTarget < 1) {
            throw new IllegalArgumentException("maturityTagTarget must be >= 1");
        }
        if (timelineLimit < 1) {
            throw new IllegalArgumentException("timelineLimit must be >= 1");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(
            0.3,
            10,
            0.1,
            30,
            0.1,
            0.1,
            1.0,
            0.1,
            0.6,
            10,
            1000,
            false
        );
    }

    public EngineConfig withStrictExclusivity(boolean strict) {
        return new EngineConfig(
            reinforcementWeight,
            maxEvidence,
            defaultDecayRate,
            decayWindowDays,
            minDecayFactor,
            minConfidence,
            maxConfidence,
            reinforcementDamping,
            confidentThreshold,
            maturityTagTarget,
            timelineLimit,
            strict
        );
    }

    public double clampConfidence(double value) {
        return Math.max(minConfidence, Math.min(maxConfidence, value));
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(name + " must be within [" + min + ", " + max + "]");
        }
    }
}
