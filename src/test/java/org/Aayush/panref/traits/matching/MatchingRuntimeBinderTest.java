package org.Aayush.panref.traits.matching;

import org.Aayush.panref.core.ReferenceEngine;
import org.Aayush.panref.core.ReferenceEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("MatchingRuntimeBinder Tests")
class MatchingRuntimeBinderTest {
    private final MatchingRuntimeBinder binder = new MatchingRuntimeBinder();

    @Test
    @DisplayName("Null config binds substring admission with compatible order")
    void testNullConfigDefaults() {
        MatchingRuntimeBinder.Binding binding = binder.bind(null, AdmissionStrategyRegistry.defaultRegistry());
        assertEquals(AdmissionStrategyRegistry.STRATEGY_SUBSTRING, binding.getAdmissionStrategy().id());
        assertEquals(ResolverOrder.COMPATIBLE, binding.getResolverOrder());
    }

    @Test
    @DisplayName("Blank strategy id falls back to substring")
    void testBlankStrategyFallsBack() {
        MatchingRuntimeConfig config = MatchingRuntimeConfig.builder().admissionStrategyId("  ").build();
        assertEquals(
                AdmissionStrategyRegistry.STRATEGY_SUBSTRING,
                binder.bind(config, AdmissionStrategyRegistry.defaultRegistry()).getAdmissionStrategy().id()
        );
    }

    @Test
    @DisplayName("Explicit strategy and order are bound")
    void testExplicitBinding() {
        MatchingRuntimeConfig config = MatchingRuntimeConfig.builder()
                .admissionStrategyId(AdmissionStrategyRegistry.STRATEGY_TOKEN_BOUNDARY)
                .resolverOrder(ResolverOrder.NESTED_BEFORE_INDIRECT)
                .build();
        MatchingRuntimeBinder.Binding binding = binder.bind(config, AdmissionStrategyRegistry.defaultRegistry());
        assertEquals(AdmissionStrategyRegistry.STRATEGY_TOKEN_BOUNDARY, binding.getAdmissionStrategy().id());
        assertEquals(ResolverOrder.NESTED_BEFORE_INDIRECT, binding.getResolverOrder());
    }

    @Test
    @DisplayName("Unknown strategy id fails with reason code")
    void testUnknownStrategy() {
        MatchingRuntimeConfig config = MatchingRuntimeConfig.builder().admissionStrategyId("REGEX").build();
        ReferenceEngineException ex = assertThrows(
                ReferenceEngineException.class,
                () -> binder.bind(config, AdmissionStrategyRegistry.defaultRegistry())
        );
        assertEquals(ReferenceEngine.REASON_UNKNOWN_MATCHING_STRATEGY, ex.getReasonCode());
    }
}
