package io.tagprofile.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tagprofile.core.config.model.StorageConfig;
import io.tagprofile.core.config.model.TagProfileConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        TagProfileConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.engine().reinforcementWeight()).isEqualTo(0.3);
        assertThat(config.engine().timelineLimit()).isEqualTo(1000);
        assertThat(config.engine().strictExclusivity()).isFalse();
        assertThat(config.storage().backend()).isEqualTo(StorageConfig.FILE);
        assertThat(config.taxonomy().isExclusive("core_profile", "gender")).isTrue();
    }

    @Test
    void shouldMergePartialConfigOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "storage": {
                "backend": "SQLite",
                "dataDir": "%s"
              },
              "engine": {
                "strictExclusivity": true
              },
              "taxonomy": {
                "dimensions": [
                  {
                    "name": "lifestyle",
                    "sub_dimensions": [
                      { "name": "diet", "exclusive": true }
                    ]
                  }
                ]
              }
            }
            """.formatted(tempDir.resolve("data").toString().replace("\\", "\\\\")));

        TagProfileConfig config = service.load(configPath);

        assertThat(config.storage().backend()).isEqualTo(StorageConfig.SQLITE);
        assertThat(config.storage().resolvedSqlitePath()).isEqualTo(tempDir.resolve("data").resolve("profiles.db"));
        assertThat(config.engine().strictExclusivity()).isTrue();
        assertThat(config.engine().maxEvidence()).isEqualTo(10);
        assertThat(config.taxonomy().isKnownCategory("core_profile")).isFalse();
        assertThat(config.taxonomy().isExclusive("lifestyle", "diet")).isTrue();
    }

    @Test
    void shouldAcceptSnakeCaseKeys() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "storage": {
                "data_dir": "%s"
              },
              "engine": {
                "strict_exclusivity": true,
                "reinforcement_weight": 0.5,
                "timeline_limit": 7
              },
              "taxonomy": {
                "dimensions": [
                  { "name": "lifestyle", "sub_dimensions": [ { "name": "diet", "exclusive": true } ] }
                ]
              }
            }
            """.formatted(tempDir.resolve("snake").toString().replace("\\", "\\\\")));

        TagProfileConfig config = service.load(configPath);

        assertThat(config.storage().resolvedDataDir()).isEqualTo(tempDir.resolve("snake"));
        assertThat(config.engine().strictExclusivity()).isTrue();
        assertThat(config.engine().reinforcementWeight()).isEqualTo(0.5);
        assertThat(config.engine().timelineLimit()).isEqualTo(7);
        assertThat(config.engine().maxEvidence()).isEqualTo(10);
        assertThat(config.taxonomy().isExclusive("lifestyle", "diet")).isTrue();
    }

    @Test
    void shouldRejectInvalidEngineSettings() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "engine": { "reinforcementWeight": 1.5 } }
            """);

        assertThatThrownBy(() -> service.load(configPath)).isInstanceOf(IOException.class);
    }

    @Test
    void initShouldWriteConfigAndCreateDataDir() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "storage": { "dataDir": "%s" } }
            """.formatted(tempDir.resolve("profiles").toString().replace("\\", "\\\\")));

        InitResult result = service.init(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.dataDir()).isEqualTo(tempDir.resolve("profiles"));
        assertThat(Files.isDirectory(result.dataDir())).isTrue();
        assertThat(Files.readString(configPath)).contains("reinforcementWeight");
    }
}
