package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one applied observation batch, holding the batch as it was submitted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimelineEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("extracted_tags") Map<String, List<TagObservation>> extractedTags
) {
    public static final String TAG_EXTRACTION = "tag_extraction";

    public TimelineEvent {
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        eventType = eventType == null || eventType.isBlank() ? TAG_EXTRACTION : eventType.trim();
        Map<String, List<TagObservation>> copy = new LinkedHashMap<>();
        if (extractedTags != null) {
            extractedTags.forEach((category, tags) ->
                copy.put(category, tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList()));
        }
        extractedTags = Collections.unmodifiableMap(copy);
    }
}
