package io.tagprofile.core.store;

import io.tagprofile.core.model.TimelineEvent;
import io.tagprofile.core.model.UserProfile;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of all users: one profile record and one bounded timeline per user id.
 * Implementations own no business logic. Unreadable records are reported as absent.
 * Calls for different users may run concurrently; calls for one user are serialized by the caller.
 */
public interface ProfileStore {
    Optional<UserProfile> load(String userId) throws IOException;

    List<TimelineEvent> timeline(String userId) throws IOException;

    /**
     * Persists the profile and appends the event, keeping at most {@code timelineLimit}
     * events. Either both writes become visible or neither does.
     */
    void commit(String userId, UserProfile profile, TimelineEvent event, int timelineLimit) throws IOException;

    /**
     * Overwrites the stored profile without touching the timeline.
     */
    void replace(String userId, UserProfile profile) throws IOException;
}
