package org.Aayush.panref.traits.matching;

import lombok.Builder;
import lombok.Value;

/**
 * Startup configuration for line admission and resolver ordering.
 *
 * <p>Bound once when {@code ReferenceEngine} is built; runs cannot switch it.</p>
 */
@Value
@Builder
public class MatchingRuntimeConfig {

    /**
     * Selected admission strategy id (for example {@code SUBSTRING}).
     */
    String admissionStrategyId;

    /**
     * Resolver stage ordering; null means {@link ResolverOrder#COMPATIBLE}.
     */
    ResolverOrder resolverOrder;

    /**
     * Returns the default runtime: substring admission, compatible resolver order.
     */
    public static MatchingRuntimeConfig defaultRuntime() {
        return MatchingRuntimeConfig.builder()
                .admissionStrategyId(AdmissionStrategyRegistry.STRATEGY_SUBSTRING)
                .resolverOrder(ResolverOrder.COMPATIBLE)
                .build();
    }
}
