package io.tagprofile.core.profile;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.config.model.TagProfileConfig;
import io.tagprofile.core.engine.DecayEngine;
import io.tagprofile.core.engine.ExclusivityResolver;
import io.tagprofile.core.engine.MetricsCalculator;
import io.tagprofile.core.engine.ProfileMetrics;
import io.tagprofile.core.engine.ReinforcementEngine;
import io.tagprofile.core.engine.UpdateOrchestrator;
import io.tagprofile.core.model.ProfileStats;
import io.tagprofile.core.model.TagObservation;
import io.tagprofile.core.model.TimelineEvent;
import io.tagprofile.core.model.UserProfile;
import io.tagprofile.core.store.ProfileStore;
import io.tagprofile.core.store.UserIds;
import io.tagprofile.core.taxonomy.TagTaxonomy;
import io.tagprofile.core.timeline.TimelineRecorder;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading and updating user profiles. Each call is a read-modify-write over
 * one user's record and runs under that user's monitor; different users never contend.
 */
public final class ProfileService {
    private static final Logger LOG = LoggerFactory.getLogger(ProfileService.class);

    private final ProfileStore store;
    private final TagTaxonomy taxonomy;
    private final UpdateOrchestrator orchestrator;
    private final MetricsCalculator metricsCalculator;
    private final TimelineRecorder timelineRecorder;
    private final Clock clock;
    private final ConcurrentHashMap<String, Object> userLocks = new ConcurrentHashMap<>();

    public ProfileService(
        ProfileStore store,
        TagTaxonomy taxonomy,
        UpdateOrchestrator orchestrator,
        MetricsCalculator metricsCalculator,
        TimelineRecorder timelineRecorder,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.metricsCalculator = Objects.requireNonNull(metricsCalculator, "metricsCalculator must not be null");
        this.timelineRecorder = Objects.requireNonNull(timelineRecorder, "timelineRecorder must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static ProfileService create(TagProfileConfig config, ProfileStore store, Clock clock) {
        EngineConfig engine = config.engine();
        TagTaxonomy taxonomy = config.taxonomy();
        MetricsCalculator metrics = new MetricsCalculator(engine);
        UpdateOrchestrator orchestrator = new UpdateOrchestrator(
            taxonomy,
            new ReinforcementEngine(engine, taxonomy, new ExclusivityResolver()),
            new DecayEngine(engine, clock.getZone()),
            metrics,
            clock
        );
        return new ProfileService(store, taxonomy, orchestrator, metrics, new TimelineRecorder(clock, engine.timelineLimit()), clock);
    }

    /**
     * Applies one observation batch. The updated profile and the timeline event are persisted
     * together; if persisting fails the previously stored profile stays in place.
     */
    public UserProfile applyObservations(String userId, Map<String, List<TagObservation>> observationsByCategory) throws IOException {
        String id = UserIds.requireValid(userId);
        Map<String, List<TagObservation>> batch = observationsByCategory == null ? Map.of() : observationsByCategory;
        synchronized (lockFor(id)) {
            UserProfile current = loadOrEmpty(id);
            UserProfile updated = orchestrator.apply(current, batch);
            TimelineEvent event = timelineRecorder.record(batch);
            store.commit(id, updated, event, timelineRecorder.limit());
            LOG.info(
                "Applied {} observations for user {} (interactions {}, maturity {})",
                batch.values().stream().filter(Objects::nonNull).mapToInt(List::size).sum(),
                id,
                updated.totalInteractions(),
                String.format("%.2f", updated.profileMaturity())
            );
            return updated;
        }
    }

    /**
     * Returns the stored profile, creating and persisting an empty one on first access.
     */
    public UserProfile getProfile(String userId) throws IOException {
        String id = UserIds.requireValid(userId);
        synchronized (lockFor(id)) {
            Optional<UserProfile> stored = store.load(id);
            if (stored.isPresent()) {
                return stored.get().withMissingDimensions(taxonomy);
            }
            UserProfile fresh = UserProfile.empty(id, taxonomy, clock.instant());
            store.replace(id, fresh);
            return fresh;
        }
    }

    public List<TimelineEvent> getTimeline(String userId) throws IOException {
        String id = UserIds.requireValid(userId);
        synchronized (lockFor(id)) {
            return List.copyOf(store.timeline(id));
        }
    }

    public ProfileStats stats(String userId) throws IOException {
        String id = UserIds.requireValid(userId);
        synchronized (lockFor(id)) {
            UserProfile profile = loadOrEmpty(id);
            ProfileMetrics metrics = metricsCalculator.calculate(profile.tagDimensions());
            return new ProfileStats(
                id,
                profile.totalInteractions(),
                profile.dimensionSummaries().size(),
                metrics.totalTags(),
                metrics.confidentTags(),
                profile.profileMaturity(),
                store.timeline(id).size(),
                profile.createdAt(),
                profile.lastUpdated()
            );
        }
    }

    /**
     * Replaces the user's profile with a fresh empty one. The timeline is kept.
     */
    public UserProfile reset(String userId) throws IOException {
        String id = UserIds.requireValid(userId);
        synchronized (lockFor(id)) {
            UserProfile fresh = UserProfile.empty(id, taxonomy, clock.instant());
            store.replace(id, fresh);
            LOG.info("Reset profile for user {}", id);
            return fresh;
        }
    }

    private UserProfile loadOrEmpty(String userId) throws IOException {
        return store.load(userId)
            .map(profile -> profile.withMissingDimensions(taxonomy))
            .orElseGet(() -> UserProfile.empty(userId, taxonomy, clock.instant()));
    }

    private Object lockFor(String userId) {
        return userLocks.computeIfAbsent(userId, key -> new Object());
    }
}
