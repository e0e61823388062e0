package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.tagprofile.core.taxonomy.TagTaxonomy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate root of one user's tag profile. Instances are immutable; the lifecycle engine
 * works on {@link #mutableDimensions()} and builds a new profile at the end of a cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
    @JsonProperty("user_id") String userId,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_updated") Instant lastUpdated,
    @JsonProperty("tag_dimensions") Map<String, Map<String, List<TagInstance>>> tagDimensions,
    @JsonProperty("profile_maturity") double profileMaturity,
    @JsonProperty("total_interactions") int totalInteractions,
    @JsonProperty("dimension_summaries") List<DimensionSummary> dimensionSummaries
) {
    public UserProfile {
        userId = userId == null ? "" : userId;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        lastUpdated = lastUpdated == null || lastUpdated.isBefore(createdAt) ? createdAt : lastUpdated;
        tagDimensions = freeze(tagDimensions);
        profileMaturity = Math.max(0.0, Math.min(1.0, profileMaturity));
        totalInteractions = Math.max(0, totalInteractions);
        dimensionSummaries = dimensionSummaries == null ? List.of() : List.copyOf(dimensionSummaries);
    }

    public static UserProfile empty(String userId, TagTaxonomy taxonomy, Instant now) {
        return new UserProfile(userId, now, now, taxonomy.emptyDimensions(), 0.0, 0, List.of());
    }

    /**
     * Deep copy of the tag dimensions with modifiable maps and lists, preserving order.
     */
    public Map<String, Map<String, List<TagInstance>>> mutableDimensions() {
        Map<String, Map<String, List<TagInstance>>> copy = new LinkedHashMap<>();
        tagDimensions.forEach((category, buckets) -> {
            Map<String, List<TagInstance>> bucketCopy = new LinkedHashMap<>();
            buckets.forEach((subcategory, tags) -> bucketCopy.put(subcategory, new ArrayList<>(tags)));
            copy.put(category, bucketCopy);
        });
        return copy;
    }

    /**
     * Adds the dimensions and sub-dimensions declared by the taxonomy that this profile
     * does not carry yet. Existing buckets are left untouched.
     */
    public UserProfile withMissingDimensions(TagTaxonomy taxonomy) {
        Map<String, Map<String, List<TagInstance>>> dimensions = mutableDimensions();
        boolean changed = false;
        for (Map.Entry<String, Map<String, List<TagInstance>>> declared : taxonomy.emptyDimensions().entrySet()) {
            Map<String, List<TagInstance>> buckets = dimensions.get(declared.getKey());
            if (buckets == null) {
                dimensions.put(declared.getKey(), declared.getValue());
                changed = true;
                continue;
            }
            for (Map.Entry<String, List<TagInstance>> bucket : declared.getValue().entrySet()) {
                if (!buckets.containsKey(bucket.getKey())) {
                    buckets.put(bucket.getKey(), bucket.getValue());
                    changed = true;
                }
            }
        }
        if (!changed) {
            return this;
        }
        return new UserProfile(userId, createdAt, lastUpdated, dimensions, profileMaturity, totalInteractions, dimensionSummaries);
    }

    private static Map<String, Map<String, List<TagInstance>>> freeze(Map<String, Map<String, List<TagInstance>>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Map<String, List<TagInstance>>> out = new LinkedHashMap<>();
        source.forEach((category, buckets) -> {
            Map<String, List<TagInstance>> frozenBuckets = new LinkedHashMap<>();
            if (buckets != null) {
                buckets.forEach((subcategory, tags) ->
                    frozenBuckets.put(subcategory, tags == null ? List.of() : List.copyOf(tags)));
            }
            out.put(category, Collections.unmodifiableMap(frozenBuckets));
        });
        return Collections.unmodifiableMap(out);
    }
}
