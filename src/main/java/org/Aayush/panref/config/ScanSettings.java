package org.Aayush.panref.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.panref.traits.matching.MatchingRuntimeConfig;
import org.Aayush.panref.traits.matching.ResolverOrder;

import java.util.List;

/**
 * Optional run settings read from a JSON settings file. Absent values are null
 * (or empty for {@code addresses}).
 */
@Value
@Builder(toBuilder = true)
public class ScanSettings {
    /** Configuration dump to scan ({@code log_file}). */
    String logFile;
    /** Target address names ({@code address_name}). */
    @Singular
    List<String> addresses;
    /** Report file override ({@code output_file}). */
    String outputFile;
    /** Admission strategy id ({@code matching_strategy}). */
    String matchingStrategy;
    /** Resolver ordering ({@code resolver_order}). */
    ResolverOrder resolverOrder;

    public static ScanSettings empty() {
        return ScanSettings.builder().build();
    }

    public boolean isEmpty() {
        return logFile == null && addresses.isEmpty() && outputFile == null
                && matchingStrategy == null && resolverOrder == null;
    }

    /**
     * Maps the matching-related settings to an engine runtime config.
     */
    public MatchingRuntimeConfig toRuntimeConfig() {
        return MatchingRuntimeConfig.builder()
                .admissionStrategyId(matchingStrategy)
                .resolverOrder(resolverOrder)
                .build();
    }
}
