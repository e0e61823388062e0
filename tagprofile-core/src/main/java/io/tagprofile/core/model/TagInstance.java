package io.tagprofile.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Durable record of a tag inside one category/subcategory bucket of a profile.
 * Timestamps stay as the ISO-8601 strings they arrived with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TagInstance(
    @JsonProperty("tag_name") String tagName,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reinforcement_count") int reinforcementCount,
    @JsonProperty("first_seen") String firstSeen,
    @JsonProperty("last_reinforced") String lastReinforced,
    @JsonProperty("evidence_list") List<String> evidenceList,
    @JsonProperty("decay_rate") double decayRate
) {
    public TagInstance {
        tagName = tagName == null ? "" : tagName;
        reinforcementCount = Math.max(1, reinforcementCount);
        firstSeen = firstSeen == null ? "" : firstSeen;
        lastReinforced = lastReinforced == null ? "" : lastReinforced;
        evidenceList = evidenceList == null
            ? List.of()
            : evidenceList.stream().filter(Objects::nonNull).toList();
        decayRate = Math.max(0.0, decayRate);
    }

    public TagInstance withConfidence(double value) {
        return new TagInstance(tagName, value, reinforcementCount, firstSeen, lastReinforced, evidenceList, decayRate);
    }
}
