package io.tagprofile.cli;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.config.model.StorageConfig;
import io.tagprofile.core.config.model.TagProfileConfig;
import io.tagprofile.core.taxonomy.Dimension;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            TagProfileConfig config = context.configService().load(context.configPath());
            StorageConfig storage = config.storage();
            EngineConfig engine = config.engine();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Storage backend: " + storage.backend());
            if (StorageConfig.SQLITE.equals(storage.backend())) {
                System.out.println("SQLite database: " + storage.resolvedSqlitePath());
            } else {
                System.out.println("Data directory: " + storage.resolvedDataDir());
            }
            System.out.println("Timeline limit: " + engine.timelineLimit());
            System.out.println("Strict exclusivity: " + engine.strictExclusivity());
            for (Dimension dimension : config.taxonomy().dimensions()) {
                System.out.println("Dimension: " + dimension.name() + " (" + dimension.subDimensions().size() + " sub-dimensions)");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
