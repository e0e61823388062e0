package io.tagprofile.cli;

import io.tagprofile.core.config.ConfigService;
import io.tagprofile.core.observation.ObservationBatchParser;
import io.tagprofile.core.observation.ObservationSource;
import io.tagprofile.core.profile.ProfileService;
import java.nio.file.Path;

public record CliContext(
    ProfileService profileService,
    ObservationSource observationSource,
    ConfigService configService,
    Path configPath
) {
    public CliContext(ProfileService profileService, ConfigService configService, Path configPath) {
        this(profileService, new ObservationBatchParser(), configService, configPath);
    }
}
