package io.tagprofile.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.tagprofile.core.config.ConfigPaths;
import java.nio.file.Path;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    @JsonAlias({"data_dir"}) String dataDir,
    @JsonAlias({"sqlite_path"}) String sqlitePath
) {
    public static final String FILE = "file";
    public static final String SQLITE = "sqlite";

    public StorageConfig {
        backend = backend == null || backend.isBlank() ? FILE : backend.trim().toLowerCase(Locale.ROOT);
        dataDir = dataDir == null ? "" : dataDir.trim();
        sqlitePath = sqlitePath == null ? "" : sqlitePath.trim();
    }

    public static StorageConfig defaults() {
        return new StorageConfig(FILE, "~/.tagprofile/data", "");
    }

    public Path resolvedDataDir() {
        return ConfigPaths.resolveDataDir(dataDir);
    }

    public Path resolvedSqlitePath() {
        if (sqlitePath.isBlank()) {
            return resolvedDataDir().resolve("profiles.db");
        }
        return ConfigPaths.expandHome(sqlitePath);
    }
}
