package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record ProfileStats(
    @JsonProperty("user_id") String userId,
    @JsonProperty("total_interactions") int totalInteractions,
    @JsonProperty("total_dimensions") int totalDimensions,
    @JsonProperty("total_tags") int totalTags,
    @JsonProperty("confident_tags") int confidentTags,
    @JsonProperty("profile_maturity") double profileMaturity,
    @JsonProperty("timeline_events") int timelineEvents,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_updated") Instant lastUpdated
) {
}
