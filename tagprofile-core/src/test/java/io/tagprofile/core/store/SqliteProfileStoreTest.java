package io.tagprofile.core.store;

import static io.tagprofile.core.store.FileProfileStoreTest.event;
import static io.tagprofile.core.store.FileProfileStoreTest.profile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tagprofile.core.model.TimelineEvent;
import io.tagprofile.core.model.UserProfile;
import io.tagprofile.core.taxonomy.TagTaxonomy;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteProfileStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistProfileAndTimelineAcrossInstances() throws Exception {
        Path db = tempDir.resolve("nested").resolve("profiles.db");
        SqliteProfileStore store = new SqliteProfileStore(db);
        UserProfile profile = profile("alice");
        TimelineEvent event = event(Instant.parse("2026-03-01T10:00:00Z"));

        store.commit("alice", profile, event, 1000);

        SqliteProfileStore reopened = new SqliteProfileStore(db);
        assertThat(reopened.load("alice")).contains(profile);
        assertThat(reopened.timeline("alice")).containsExactly(event);
        assertThat(reopened.load("bob")).isEmpty();
        assertThat(reopened.timeline("bob")).isEmpty();
    }

    @Test
    void shouldTrimTimelinePerUser() throws Exception {
        SqliteProfileStore store = new SqliteProfileStore(tempDir.resolve("profiles.db"));
        for (int i = 0; i < 6; i++) {
            store.commit("alice", profile("alice"), event(Instant.ofEpochSecond(i)), 3);
        }
        store.commit("bob", profile("bob"), event(Instant.ofEpochSecond(100)), 3);

        List<TimelineEvent> alice = store.timeline("alice");

        assertThat(alice).extracting(TimelineEvent::timestamp)
            .containsExactly(Instant.ofEpochSecond(3), Instant.ofEpochSecond(4), Instant.ofEpochSecond(5));
        assertThat(store.timeline("bob")).hasSize(1);
    }

    @Test
    void replaceShouldOverwriteProfileAndKeepTimeline() throws Exception {
        SqliteProfileStore store = new SqliteProfileStore(tempDir.resolve("profiles.db"));
        store.commit("alice", profile("alice"), event(Instant.ofEpochSecond(1)), 10);

        UserProfile fresh = UserProfile.empty("alice", TagTaxonomy.defaults(), Instant.parse("2026-03-02T00:00:00Z"));
        store.replace("alice", fresh);

        assertThat(store.load("alice")).contains(fresh);
        assertThat(store.timeline("alice")).hasSize(1);
    }

    @Test
    void shouldCommitDifferentUsersConcurrently() throws Exception {
        SqliteProfileStore store = new SqliteProfileStore(tempDir.resolve("profiles.db"));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int user = 0; user < 4; user++) {
                String userId = "user-" + user;
                tasks.add(() -> {
                    for (int i = 0; i < 10; i++) {
                        store.commit(userId, profile(userId), event(Instant.ofEpochSecond(i)), 1000);
                    }
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        for (int user = 0; user < 4; user++) {
            assertThat(store.load("user-" + user)).contains(profile("user-" + user));
            assertThat(store.timeline("user-" + user)).hasSize(10);
        }
    }

    @Test
    void shouldRejectInvalidUserIds() throws Exception {
        SqliteProfileStore store = new SqliteProfileStore(tempDir.resolve("profiles.db"));

        assertThatThrownBy(() -> store.load("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.load("a b")).isInstanceOf(IllegalArgumentException.class);
    }
}
