package io.tagprofile.core.engine;

import io.tagprofile.core.model.TagInstance;
import io.tagprofile.core.model.TagObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps exclusive sub-dimensions to one dominant value. A new candidate only displaces the
 * strongest existing instance when it is strictly more confident; a weaker candidate is
 * inserted next to it. {@link #prune(List)} is the opt-in strict mode.
 */
public final class ExclusivityResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ExclusivityResolver.class);

    public Optional<TagInstance> resolve(List<TagInstance> bucket, TagObservation candidate) {
        Optional<TagInstance> strongest = strongest(bucket);
        if (strongest.isEmpty()) {
            return Optional.empty();
        }
        TagInstance current = strongest.get();
        if (candidate.confidence() > current.confidence()) {
            bucket.remove(current);
            LOG.debug("Replaced exclusive tag {} with {}", current.tagName(), candidate.name());
            return strongest;
        }
        return Optional.empty();
    }

    public List<TagInstance> prune(List<TagInstance> bucket) {
        Optional<TagInstance> strongest = strongest(bucket);
        if (strongest.isEmpty() || bucket.size() == 1) {
            return List.of();
        }
        List<TagInstance> removed = new ArrayList<>(bucket);
        removed.remove(strongest.get());
        bucket.clear();
        bucket.add(strongest.get());
        LOG.debug("Pruned {} weaker exclusive tags, kept {}", removed.size(), strongest.get().tagName());
        return removed;
    }

    /**
     * Highest-confidence instance; the first one encountered wins ties.
     */
    public static Optional<TagInstance> strongest(List<TagInstance> bucket) {
        TagInstance best = null;
        for (TagInstance instance : bucket) {
            if (best == null || instance.confidence() > best.confidence()) {
                best = instance;
            }
        }
        return Optional.ofNullable(best);
    }
}
