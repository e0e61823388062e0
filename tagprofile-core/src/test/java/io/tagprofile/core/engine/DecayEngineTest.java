package io.tagprofile.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.tagprofile.core.config.model.EngineConfig;
import io.tagprofile.core.model.TagInstance;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DecayEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final DecayEngine engine = new DecayEngine(EngineConfig.defaults(), ZoneOffset.UTC);

    @Test
    void shouldStillDivideByReinforcementTermOnSameDay() {
        TagInstance decayed = engine.decay(instance(0.62, 2, "2026-03-01T08:00:00Z"), NOW);

        assertThat(decayed.confidence()).isCloseTo(0.62 / 1.2, within(1e-9));
    }

    @Test
    void shouldApplyLinearDecayFactorOverElapsedDays() {
        TagInstance decayed = engine.decay(instance(0.5, 1, "2026-01-30T12:00:00Z"), NOW);

        // 30 days at rate 0.1 over a 30 day window -> factor 0.9
        assertThat(decayed.confidence()).isCloseTo(0.5 / 1.1 * 0.9, within(1e-9));
    }

    @Test
    void shouldRoundElapsedTimeDownToWholeDays() {
        TagInstance almostTwoDays = engine.decay(instance(0.5, 1, "2026-02-27T13:00:00Z"), NOW);

        assertThat(almostTwoDays.confidence()).isCloseTo(0.5 / 1.1 * (1 - 0.1 / 30), within(1e-9));
    }

    @Test
    void shouldFloorConfidenceAtMinimum() {
        TagInstance decayed = engine.decay(instance(0.5, 1, "2000-01-01T00:00:00Z"), NOW);

        assertThat(decayed.confidence()).isEqualTo(0.1);
    }

    @Test
    void shouldBeNonIncreasingAsDaysGrow() {
        double previous = Double.MAX_VALUE;
        for (long days = 0; days <= 400; days++) {
            double value = engine.decayedConfidence(0.9, 3, 0.1, days);
            assertThat(value).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(0.1);
            previous = value;
        }
        assertThat(previous).isEqualTo(0.1);
    }

    @Test
    void shouldSkipInstancesWithUnparseableTimestamp() {
        TagInstance broken = instance(0.77, 4, "yesterday-ish");

        assertThat(engine.decay(broken, NOW)).isEqualTo(broken);
    }

    @Test
    void shouldReadTimestampsWithoutOffsetInConfiguredZone() {
        TagInstance decayed = engine.decay(instance(0.66, 1, "2026-03-01T09:30:00.123456"), NOW);

        assertThat(decayed.confidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void shouldTreatFutureTimestampsAsReinforcedToday() {
        TagInstance decayed = engine.decay(instance(0.55, 1, "2026-06-01T00:00:00Z"), NOW);

        assertThat(decayed.confidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldDecayEveryInstanceInTheProfile() {
        Map<String, Map<String, List<TagInstance>>> dimensions = new LinkedHashMap<>();
        Map<String, List<TagInstance>> core = new LinkedHashMap<>();
        core.put("region", new ArrayList<>(List.of(instance(0.55, 1, "2026-03-01T00:00:00Z"))));
        core.put("age_range", new ArrayList<>());
        Map<String, List<TagInstance>> usage = new LinkedHashMap<>();
        usage.put("feature_preference", new ArrayList<>(List.of(instance(0.77, 1, "2026-03-01T00:00:00Z"), instance(0.99, 1, "bad"))));
        dimensions.put("core_profile", core);
        dimensions.put("product_usage", usage);

        engine.apply(dimensions, NOW);

        assertThat(dimensions.get("core_profile").get("region").get(0).confidence()).isCloseTo(0.5, within(1e-9));
        List<TagInstance> usageTags = dimensions.get("product_usage").get("feature_preference");
        assertThat(usageTags.get(0).confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(usageTags.get(1).confidence()).isEqualTo(0.99);
    }

    private TagInstance instance(double confidence, int reinforcementCount, String lastReinforced) {
        return new TagInstance("tag", confidence, reinforcementCount, lastReinforced, lastReinforced, List.of("evidence"), 0.1);
    }
}
