package io.tagprofile.core.timeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.model.TimelineEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimelineRecorderTest {

    @Test
    void shouldRecordBatchAsSubmitted() {
        TimelineRecorder recorder = new TimelineRecorder(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC), 1000);
        Map<String, List<TagObservation>> batch = Map.of(
            "unknown_category", List.of(new TagObservation("x", 0.4, "e", "unknown_category", "y", ""))
        );

        TimelineEvent event = recorder.record(batch);

        assertThat(event.timestamp()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThat(event.eventType()).isEqualTo("tag_extraction");
        assertThat(event.extractedTags()).isEqualTo(batch);
    }

    @Test
    void shouldEvictOldestEventsBeyondLimit() {
        List<TimelineEvent> events = new ArrayList<>();
        for (int i = 0; i < 1005; i++) {
            events = TimelineRecorder.append(events, event(i), 1000);
        }

        assertThat(events).hasSize(1000);
        assertThat(events.get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(5));
        assertThat(events.get(999).timestamp()).isEqualTo(Instant.ofEpochSecond(1004));
    }

    private TimelineEvent event(int second) {
        return new TimelineEvent(Instant.ofEpochSecond(second), TimelineEvent.TAG_EXTRACTION, Map.of());
    }
}
