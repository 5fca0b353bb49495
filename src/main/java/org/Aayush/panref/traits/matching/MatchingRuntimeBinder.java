package org.Aayush.panref.traits.matching;

import lombok.Builder;
import lombok.Value;
import org.Aayush.panref.core.ReferenceEngine;
import org.Aayush.panref.core.ReferenceEngineException;

import java.util.Objects;

/**
 * Startup-only binder resolving a {@link MatchingRuntimeConfig} into concrete strategies.
 */
public final class MatchingRuntimeBinder {

    /**
     * Resolves one runtime config into an immutable binding.
     *
     * @param runtimeConfig config selected at startup; null selects defaults.
     * @param registry admission strategy registry.
     * @return immutable runtime binding.
     * @throws ReferenceEngineException when the strategy id is not registered.
     */
    public Binding bind(MatchingRuntimeConfig runtimeConfig, AdmissionStrategyRegistry registry) {
        MatchingRuntimeConfig config = runtimeConfig == null ? MatchingRuntimeConfig.defaultRuntime() : runtimeConfig;
        AdmissionStrategyRegistry nonNullRegistry = Objects.requireNonNull(registry, "registry");

        String strategyId = normalizeOptionalId(config.getAdmissionStrategyId());
        if (strategyId == null) {
            strategyId = AdmissionStrategyRegistry.STRATEGY_SUBSTRING;
        }
        AdmissionStrategy strategy = nonNullRegistry.strategy(strategyId);
        if (strategy == null) {
            throw new ReferenceEngineException(
                    ReferenceEngine.REASON_UNKNOWN_MATCHING_STRATEGY,
                    "unknown admission strategy id: " + strategyId
            );
        }

        return Binding.builder()
                .admissionStrategy(strategy)
                .resolverOrder(config.getResolverOrder() == null ? ResolverOrder.COMPATIBLE : config.getResolverOrder())
                .build();
    }

    private static String normalizeOptionalId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim();
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Immutable runtime binding result.
     */
    @Value
    @Builder
    public static class Binding {
        AdmissionStrategy admissionStrategy;
        ResolverOrder resolverOrder;
    }
}
