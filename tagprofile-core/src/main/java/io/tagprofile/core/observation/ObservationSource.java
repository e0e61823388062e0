package io.tagprofile.core.observation;

import io.tagprofile.core.model.TagObservation;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Turns free text into a batch of tag observations grouped by category.
 */
@FunctionalInterface
public interface ObservationSource {
    Map<String, List<TagObservation>> extract(String text) throws IOException;
}
