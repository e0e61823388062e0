package io.tagprofile.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.tagprofile.core.model.TimelineEvent;
import io.tagprofile.core.model.UserProfile;
import io.tagprofile.core.timeline.TimelineRecorder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each user under {@code <baseDir>/<userId>/} as {@code profile.json} and
 * {@code timeline.json}. Files are written to a temporary sibling and moved into place.
 * Users live in separate directories; callers serialize access per user.
 */
public final class FileProfileStore implements ProfileStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileProfileStore.class);
    private static final String PROFILE_FILE = "profile.json";
    private static final String TIMELINE_FILE = "timeline.json";
    private static final TypeReference<List<TimelineEvent>> TIMELINE_EVENTS = new TypeReference<>() {
    };

    private final Path baseDir;
    private final ObjectMapper mapper;

    public FileProfileStore(Path baseDir) {
        if (baseDir == null) {
            throw new IllegalArgumentException("baseDir must not be null");
        }
        this.baseDir = baseDir;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public Optional<UserProfile> load(String userId) throws IOException {
        Path path = userDir(userId).resolve(PROFILE_FILE);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(Files.readString(path), UserProfile.class));
        } catch (Exception e) {
            LOG.warn("Unreadable profile for user {}, treating as absent: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<TimelineEvent> timeline(String userId) throws IOException {
        return readTimeline(userDir(userId).resolve(TIMELINE_FILE), userId);
    }

    @Override
    public void commit(String userId, UserProfile profile, TimelineEvent event, int timelineLimit) throws IOException {
        Path dir = userDir(userId);
        Files.createDirectories(dir);
        Path profilePath = dir.resolve(PROFILE_FILE);
        Path timelinePath = dir.resolve(TIMELINE_FILE);

        List<TimelineEvent> events = TimelineRecorder.append(readTimeline(timelinePath, userId), event, timelineLimit);
        Path profileTmp = writeTmp(profilePath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile));
        Path timelineTmp = writeTmp(timelinePath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(events));
        Path backup = profilePath.resolveSibling(PROFILE_FILE + ".bak");
        boolean hadProfile = Files.exists(profilePath);
        try {
            if (hadProfile) {
                Files.copy(profilePath, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(profileTmp, profilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            try {
                Files.move(timelineTmp, timelinePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                try {
                    restoreProfile(profilePath, backup, hadProfile);
                } catch (IOException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
                throw e;
            }
        } finally {
            Files.deleteIfExists(profileTmp);
            Files.deleteIfExists(timelineTmp);
            Files.deleteIfExists(backup);
        }
    }

    @Override
    public void replace(String userId, UserProfile profile) throws IOException {
        Path dir = userDir(userId);
        Files.createDirectories(dir);
        Path profilePath = dir.resolve(PROFILE_FILE);
        Path tmp = writeTmp(profilePath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile));
        Files.move(tmp, profilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private List<TimelineEvent> readTimeline(Path path, String userId) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return mapper.readValue(Files.readString(path), TIMELINE_EVENTS);
        } catch (Exception e) {
            LOG.warn("Unreadable timeline for user {}, starting a new one: {}", userId, e.getMessage());
            return List.of();
        }
    }

    private void restoreProfile(Path profilePath, Path backup, boolean hadProfile) throws IOException {
        if (hadProfile) {
            Files.move(backup, profilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } else {
            Files.deleteIfExists(profilePath);
        }
    }

    private Path writeTmp(Path target, String json) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        return tmp;
    }

    private Path userDir(String userId) {
        return baseDir.resolve(UserIds.requireValid(userId));
    }
}
