package io.tagprofile.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.tagprofile.core.model.TagInstance;
import io.tagprofile.core.model.TagObservation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExclusivityResolverTest {

    private final ExclusivityResolver resolver = new ExclusivityResolver();

    @Test
    void shouldDoNothingForEmptyBucket() {
        List<TagInstance> bucket = new ArrayList<>();

        assertThat(resolver.resolve(bucket, candidate(0.9))).isEmpty();
        assertThat(bucket).isEmpty();
    }

    @Test
    void shouldRemoveOnlyTheStrongestInstanceWhenCandidateIsStronger() {
        List<TagInstance> bucket = new ArrayList<>(List.of(instance("a", 0.3), instance("b", 0.5), instance("c", 0.2)));

        assertThat(resolver.resolve(bucket, candidate(0.6))).map(TagInstance::tagName).contains("b");
        assertThat(bucket).extracting(TagInstance::tagName).containsExactly("a", "c");
    }

    @Test
    void shouldKeepExistingInstanceOnEqualConfidence() {
        List<TagInstance> bucket = new ArrayList<>(List.of(instance("a", 0.5)));

        assertThat(resolver.resolve(bucket, candidate(0.5))).isEmpty();
        assertThat(bucket).hasSize(1);
    }

    @Test
    void shouldPickFirstEncounteredInstanceOnTies() {
        List<TagInstance> bucket = List.of(instance("first", 0.7), instance("second", 0.7));

        assertThat(ExclusivityResolver.strongest(bucket)).map(TagInstance::tagName).contains("first");
    }

    @Test
    void pruneShouldKeepSingleStrongestInstance() {
        List<TagInstance> bucket = new ArrayList<>(List.of(instance("a", 0.3), instance("b", 0.8), instance("c", 0.8)));

        List<TagInstance> removed = resolver.prune(bucket);

        assertThat(bucket).extracting(TagInstance::tagName).containsExactly("b");
        assertThat(removed).extracting(TagInstance::tagName).containsExactly("a", "c");
    }

    private TagInstance instance(String name, double confidence) {
        return new TagInstance(name, confidence, 1, "2026-01-01T00:00:00Z", "2026-01-01T00:00:00Z", List.of(), 0.1);
    }

    private TagObservation candidate(double confidence) {
        return new TagObservation("candidate", confidence, "", "core_profile", "gender", "2026-01-02T00:00:00Z");
    }
}
