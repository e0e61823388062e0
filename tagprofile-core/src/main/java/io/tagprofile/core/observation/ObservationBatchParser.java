package io.tagprofile.core.observation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tagprofile.core.model.TagObservation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON emitted by a tag extractor. Two shapes are accepted per category:
 *
 * <pre>
 * {"core_profile": {"age_range": [{"tag_name": "25-34", "confidence": 0.8, "evidence": "..."}]}}
 * {"core_profile": [{"name": "25-34", "subcategory": "age_range", "confidence": 0.8, "evidence": "..."}]}
 * </pre>
 *
 * The second one is the shape recorded in timeline events, so recorded batches can be replayed.
 */
public final class ObservationBatchParser implements ObservationSource {
    private static final Logger LOG = LoggerFactory.getLogger(ObservationBatchParser.class);

    private final ObjectMapper mapper;

    public ObservationBatchParser() {
        this.mapper = new ObjectMapper();
    }

    @Override
    public Map<String, List<TagObservation>> extract(String text) throws IOException {
        return parse(text);
    }

    public Map<String, List<TagObservation>> parse(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public Map<String, List<TagObservation>> parse(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Observation batch must be a JSON object keyed by category");
        }

        Map<String, List<TagObservation>> batch = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> categories = root.fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> category = categories.next();
            List<TagObservation> observations = new ArrayList<>();
            JsonNode value = category.getValue();
            if (value.isObject()) {
                value.fields().forEachRemaining(sub -> readList(category.getKey(), sub.getKey(), sub.getValue(), observations));
            } else if (value.isArray()) {
                readList(category.getKey(), null, value, observations);
            } else {
                LOG.debug("Skipping category {}: expected object or array", category.getKey());
                continue;
            }
            batch.put(category.getKey(), observations);
        }
        return batch;
    }

    private void readList(String category, String subcategory, JsonNode list, List<TagObservation> out) {
        if (!list.isArray()) {
            return;
        }
        for (JsonNode item : list) {
            if (!item.isObject()) {
                continue;
            }
            String name = text(item, "tag_name", text(item, "name", ""));
            String sub = subcategory != null ? subcategory : text(item, "subcategory", "");
            if (name.isBlank() || sub.isBlank()) {
                LOG.debug("Skipping observation without tag name or subcategory in {}", category);
                continue;
            }
            JsonNode confidence = item.get("confidence");
            out.add(new TagObservation(
                name,
                confidence == null || confidence.isNull() ? TagObservation.DEFAULT_CONFIDENCE : confidence.asDouble(TagObservation.DEFAULT_CONFIDENCE),
                text(item, "evidence", ""),
                category,
                sub,
                text(item, "timestamp", "")
            ));
        }
    }

    private String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText(fallback);
    }
}
