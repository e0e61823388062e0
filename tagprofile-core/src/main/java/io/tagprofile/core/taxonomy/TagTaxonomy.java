package io.tagprofile.core.taxonomy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.tagprofile.core.model.TagInstance;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Two-level classification of tags. Only the top-level dimension names gate ingestion;
 * sub-dimension names are open, and the declared ones are used to pre-create empty
 * buckets and to mark which sub-dimensions hold at most one dominant value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TagTaxonomy(List<Dimension> dimensions) {

    public TagTaxonomy {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        Set<String> seen = new HashSet<>();
        for (Dimension dimension : dimensions) {
            if (!seen.add(dimension.name())) {
                throw new IllegalArgumentException("duplicate dimension '" + dimension.name() + "'");
            }
        }
    }

    public static TagTaxonomy defaults() {
        return new TagTaxonomy(List.of(
            new Dimension("core_profile", List.of(
                SubDimension.exclusive("age_range"),
                SubDimension.exclusive("gender"),
                SubDimension.of("region"),
                SubDimension.of("health_role")
            )),
            new Dimension("product_usage", List.of(
                SubDimension.of("feature_preference"),
                SubDimension.of("interaction_preference")
            )),
            new Dimension("intent_and_conversion", List.of(
                SubDimension.of("intent_category"),
                SubDimension.of("conversion_stage")
            )),
            new Dimension("commercial_value", List.of(
                SubDimension.of("value_tier"),
                SubDimension.of("price_sensitivity")
            ))
        ));
    }

    public Optional<Dimension> dimension(String name) {
        return dimensions.stream().filter(dimension -> dimension.name().equals(name)).findFirst();
    }

    public boolean isKnownCategory(String category) {
        return dimension(category).isPresent();
    }

    public boolean isExclusive(String category, String subcategory) {
        return dimension(category)
            .flatMap(dimension -> dimension.subDimension(subcategory))
            .map(SubDimension::exclusive)
            .orElse(false);
    }

    public Map<String, Map<String, List<TagInstance>>> emptyDimensions() {
        Map<String, Map<String, List<TagInstance>>> out = new LinkedHashMap<>();
        for (Dimension dimension : dimensions) {
            Map<String, List<TagInstance>> buckets = new LinkedHashMap<>();
            for (SubDimension sub : dimension.subDimensions()) {
                buckets.put(sub.name(), new ArrayList<>());
            }
            out.put(dimension.name(), buckets);
        }
        return out;
    }
}
