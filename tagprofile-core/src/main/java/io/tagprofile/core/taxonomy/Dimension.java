package io.tagprofile.core.taxonomy;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Dimension(
    String name,
    @JsonAlias({"sub_dimensions", "subdimensions"}) List<SubDimension> subDimensions
) {

    public Dimension {
        name = name == null ? "" : name.trim();
        if (name.isBlank()) {
            throw new IllegalArgumentException("dimension name must not be blank");
        }
        subDimensions = subDimensions == null ? List.of() : List.copyOf(subDimensions);
        Set<String> seen = new HashSet<>();
        for (SubDimension sub : subDimensions) {
            if (!seen.add(sub.name())) {
                throw new IllegalArgumentException("duplicate sub-dimension '" + sub.name() + "' in dimension '" + name + "'");
            }
        }
    }

    public Optional<SubDimension> subDimension(String subName) {
        return subDimensions.stream().filter(sub -> sub.name().equals(subName)).findFirst();
    }
}
