package io.mnemo.core.consolidation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ConsolidationPolicyTest {

    @Test
    void shouldFallBackToDefaultsForUnsetFields() {
        ConsolidationPolicy policy = ConsolidationPolicy.defaults();

        assertThat(policy.strategy()).isEqualTo(ConsolidationStrategy.BALANCED);
        assertThat(policy.redundancyThreshold()).isEqualTo(0.9);
        assertThat(policy.decayFactor()).isEqualTo(0.92);
        assertThat(policy.minConfidence()).isEqualTo(0.15);
        assertThat(policy.staleAfterHours()).isEqualTo(336.0);
    }

    @Test
    void shouldClampOutOfRangeValuesInsteadOfRejectingThem() {
        ConsolidationPolicy low = ConsolidationPolicy.builder()
            .redundancyThreshold(0.1)
            .decayFactor(0.0)
            .minConfidence(0.0)
            .staleAfterHours(0.5)
            .build();
        ConsolidationPolicy high = ConsolidationPolicy.builder()
            .redundancyThreshold(1.5)
            .decayFactor(2.0)
            .minConfidence(1.0)
            .staleAfterHours(100_000.0)
            .build();

        assertThat(low.redundancyThreshold()).isEqualTo(0.6);
        assertThat(low.decayFactor()).isEqualTo(0.5);
        assertThat(low.minConfidence()).isEqualTo(0.05);
        assertThat(low.staleAfterHours()).isEqualTo(1.0);
        assertThat(high.redundancyThreshold()).isEqualTo(0.99);
        assertThat(high.decayFactor()).isEqualTo(0.999);
        assertThat(high.minConfidence()).isEqualTo(0.95);
        assertThat(high.staleAfterHours()).isEqualTo(8760.0);
    }

    @Test
    void shouldTreatNonPositiveStaleWindowAsUnset() {
        ConsolidationPolicy policy = ConsolidationPolicy.builder().staleAfterHours(-3.0).build();

        assertThat(policy.staleAfterHours()).isEqualTo(ConsolidationPolicy.DEFAULT_STALE_AFTER_HOURS);
        assertThat(policy.staleAfterMillis()).isEqualTo(336L * 60 * 60 * 1000);
    }

    @Test
    void shouldDefaultUnknownStrategyToBalanced() {
        assertThat(ConsolidationStrategy.fromWire("reckless")).isEqualTo(ConsolidationStrategy.BALANCED);
        assertThat(ConsolidationStrategy.fromWire(" Aggressive ")).isEqualTo(ConsolidationStrategy.AGGRESSIVE);
    }
}
