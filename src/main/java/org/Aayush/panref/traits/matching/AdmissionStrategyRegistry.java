package org.Aayush.panref.traits.matching;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of the built-in line admission strategies by id.
 */
public final class AdmissionStrategyRegistry {
    public static final String STRATEGY_SUBSTRING = "SUBSTRING";
    public static final String STRATEGY_TOKEN_BOUNDARY = "TOKEN_BOUNDARY";

    private static final AdmissionStrategyRegistry DEFAULT = new AdmissionStrategyRegistry();

    private final Map<String, AdmissionStrategy> strategiesById;

    private AdmissionStrategyRegistry() {
        Map<String, AdmissionStrategy> byId = new LinkedHashMap<>();
        register(byId, new SubstringAdmissionStrategy());
        register(byId, new TokenBoundaryAdmissionStrategy());
        this.strategiesById = Collections.unmodifiableMap(byId);
    }

    /**
     * Returns the strategy registered under {@code strategyId} (surrounding
     * whitespace ignored), or null.
     */
    public AdmissionStrategy strategy(String strategyId) {
        return strategyId == null ? null : strategiesById.get(strategyId.trim());
    }

    /**
     * Registered ids in registration order.
     */
    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    public static AdmissionStrategyRegistry defaultRegistry() {
        return DEFAULT;
    }

    private static void register(Map<String, AdmissionStrategy> byId, AdmissionStrategy strategy) {
        byId.put(strategy.id(), strategy);
    }
}
