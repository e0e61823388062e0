package io.tagprofile.core.timeline;

import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.model.TimelineEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the audit event for an applied batch and bounds the per-user log, dropping the
 * oldest events first.
 */
public final class TimelineRecorder {
    private final Clock clock;
    private final int limit;

    public TimelineRecorder(Clock clock, int limit) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        this.limit = limit;
    }

    public TimelineEvent record(Map<String, List<TagObservation>> extractedTags) {
        return new TimelineEvent(clock.instant(), TimelineEvent.TAG_EXTRACTION, extractedTags);
    }

    public int limit() {
        return limit;
    }

    public static List<TimelineEvent> append(List<TimelineEvent> events, TimelineEvent event, int limit) {
        List<TimelineEvent> all = new ArrayList<>(events);
        all.add(event);
        if (all.size() > limit) {
            all = new ArrayList<>(all.subList(all.size() - limit, all.size()));
        }
        return all;
    }
}
