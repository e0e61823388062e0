package io.tagprofile.core.taxonomy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubDimension(String name, boolean exclusive) {

    public SubDimension {
        name = name == null ? "" : name.trim();
        if (name.isBlank()) {
            throw new IllegalArgumentException("sub-dimension name must not be blank");
        }
    }

    public static SubDimension of(String name) {
        return new SubDimension(name, false);
    }

    public static SubDimension exclusive(String name) {
        return new SubDimension(name, true);
    }
}
