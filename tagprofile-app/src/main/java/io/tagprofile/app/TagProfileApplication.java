package io.tagprofile.app;

import io.tagprofile.cli.ApplyCommand;
import io.tagprofile.cli.CliContext;
import io.tagprofile.cli.InitCommand;
import io.tagprofile.cli.ResetCommand;
import io.tagprofile.cli.ShowCommand;
import io.tagprofile.cli.StatsCommand;
import io.tagprofile.cli.StatusCommand;
import io.tagprofile.cli.TagProfileCliCommand;
import io.tagprofile.cli.TimelineCommand;
import io.tagprofile.core.config.ConfigPaths;
import io.tagprofile.core.config.ConfigService;
import io.tagprofile.core.config.model.StorageConfig;
import io.tagprofile.core.config.model.TagProfileConfig;
import io.tagprofile.core.observation.ObservationBatchParser;
import io.tagprofile.core.profile.ProfileService;
import io.tagprofile.core.store.FileProfileStore;
import io.tagprofile.core.store.ProfileStore;
import io.tagprofile.core.store.SqliteProfileStore;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class TagProfileApplication {
    private static final Logger LOG = LoggerFactory.getLogger(TagProfileApplication.class);

    private TagProfileApplication() {
    }

    public static void main(String[] args) {
        Path configPath = resolveConfigPath();
        ConfigService configService = new ConfigService();
        TagProfileConfig config = loadConfig(configService, configPath);

        ProfileService profileService = ProfileService.create(config, buildProfileStore(config.storage()), Clock.systemDefaultZone());
        CliContext context = new CliContext(profileService, new ObservationBatchParser(), configService, configPath);

        CommandLine commandLine = new CommandLine(new TagProfileCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("apply", new ApplyCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("timeline", new TimelineCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("reset", new ResetCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static Path resolveConfigPath() {
        String raw = System.getenv("TAGPROFILE_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.expandHome(raw.trim());
    }

    private static TagProfileConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config {}, using defaults: {}", configPath, e.getMessage());
            return TagProfileConfig.defaults();
        }
    }

    static ProfileStore buildProfileStore(StorageConfig storage) {
        if (StorageConfig.SQLITE.equals(storage.backend())) {
            Path sqlitePath = storage.resolvedSqlitePath();
            try {
                return new SqliteProfileStore(sqlitePath);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to initialize SQLite profile store at " + sqlitePath, e);
            }
        }
        if (StorageConfig.FILE.equals(storage.backend())) {
            return new FileProfileStore(storage.resolvedDataDir());
        }
        throw new IllegalArgumentException("Unknown storage backend: " + storage.backend());
    }
}
