package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DimensionSummary(
    @JsonProperty("dimension_name") String dimensionName,
    @JsonProperty("subdimension_name") String subdimensionName,
    @JsonProperty("dominant_tag") String dominantTag,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("tag_count") int tagCount,
    @JsonProperty("last_updated") String lastUpdated
) {
}
