package io.tagprofile.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.tagprofile.core.taxonomy.TagTaxonomy;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TagProfileConfig(
    StorageConfig storage,
    EngineConfig engine,
    TagTaxonomy taxonomy
) {

    public TagProfileConfig {
        storage = storage == null ? StorageConfig.defaults() : storage;
        engine = engine == null ? EngineConfig.defaults() : engine;
        taxonomy = taxonomy == null ? TagTaxonomy.defaults() : taxonomy;
    }

    public static TagProfileConfig defaults() {
        return new TagProfileConfig(
            StorageConfig.defaults(),
            EngineConfig.defaults(),
            TagTaxonomy.defaults()
        );
    }
}
