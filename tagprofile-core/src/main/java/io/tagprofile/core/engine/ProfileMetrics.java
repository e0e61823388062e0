package io.tagprofile.core.engine;

import io.tagprofile.core.model.DimensionSummary;
import java.util.List;

public record ProfileMetrics(
    List<DimensionSummary> summaries,
    int totalTags,
    int confidentTags,
    double maturity
) {
    public ProfileMetrics {
        summaries = summaries == null ? List.of() : List.copyOf(summaries);
    }
}
