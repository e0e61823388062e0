package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One candidate attribute produced by an observation source for a category/subcategory.
 * Confidence is clamped into {@code [0, 1]}; a missing or non-finite value falls back to 0.5.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TagObservation(
    String name,
    double confidence,
    String evidence,
    String category,
    String subcategory,
    String timestamp
) {
    public static final double DEFAULT_CONFIDENCE = 0.5;

    public TagObservation {
        name = name == null ? "" : name.trim();
        confidence = Double.isFinite(confidence) ? Math.max(0.0, Math.min(1.0, confidence)) : DEFAULT_CONFIDENCE;
        evidence = evidence == null ? "" : evidence;
        category = category == null ? "" : category.trim();
        subcategory = subcategory == null ? "" : subcategory.trim();
        timestamp = timestamp == null ? "" : timestamp.trim();
    }

    @JsonCreator
    static TagObservation fromJson(
        @JsonProperty("name") String name,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("evidence") String evidence,
        @JsonProperty("category") String category,
        @JsonProperty("subcategory") String subcategory,
        @JsonProperty("timestamp") String timestamp
    ) {
        return new TagObservation(
            name,
            confidence == null ? DEFAULT_CONFIDENCE : confidence,
            evidence,
            category,
            subcategory,
            timestamp
        );
    }

    public TagObservation withTimestamp(String value) {
        return new TagObservation(name, confidence, evidence, category, subcategory, value);
    }
}
