package org.Aayush.panref.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.classify.LineClassifier;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.report.ReportAssembler;
import org.Aayush.panref.report.ReportCategory;
import org.Aayush.panref.resolve.IndirectReferenceResolver;
import org.Aayush.panref.resolve.NestedGroupResolver;
import org.Aayush.panref.resolve.RedundancyDetector;
import org.Aayush.panref.resolve.ResolverStage;
import org.Aayush.panref.traits.matching.AdmissionStrategy;
import org.Aayush.panref.traits.matching.AdmissionStrategyRegistry;
import org.Aayush.panref.traits.matching.MatchingRuntimeBinder;
import org.Aayush.panref.traits.matching.MatchingRuntimeConfig;
import org.Aayush.panref.traits.matching.ResolverOrder;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main relationship-resolution entry point.
 *
 * <p>One run executes these stages over a configuration source:</p>
 * <ul>
 * <li>Primary scan: index address definitions, merge direct facts into admitted targets.</li>
 * <li>Redundancy detection over the IP/netmask index.</li>
 * <li>Indirect rule re-scan and nested group re-scan, ordered by {@link ResolverOrder}.</li>
 * </ul>
 *
 * <p>Primary-scan failures are fatal: the run reports {@link StageStatus#FATAL} and
 * exposes no results. Resolver failures degrade the run; results gathered so far are
 * kept. Each run replaces the result table of the previous one.</p>
 */
@Slf4j
public final class ReferenceEngine {
    public static final String REASON_TARGETS_REQUIRED = "TARGETS_REQUIRED";
    public static final String REASON_INVALID_TARGET = "INVALID_TARGET";
    public static final String REASON_INPUT_NOT_FOUND = "INPUT_NOT_FOUND";
    public static final String REASON_INPUT_READ_ERROR = "INPUT_READ_ERROR";
    public static final String REASON_RESOLVER_FAILED = "RESOLVER_FAILED";
    public static final String REASON_UNKNOWN_MATCHING_STRATEGY = "UNKNOWN_MATCHING_STRATEGY";

    private final LineClassifier lineClassifier;
    private final AdmissionStrategy admissionStrategy;
    private final ResolverOrder resolverOrder;
    private final ReportAssembler reportAssembler = new ReportAssembler();
    private final PrimaryScanner primaryScanner = new PrimaryScanner();

    private ResultTable results = new ResultTable();

    /**
     * Creates an engine with the admission strategy and resolver order bound at startup.
     *
     * @param matchingRuntimeConfig optional runtime config (defaults: substring, compatible order).
     * @param lineClassifier optional classifier override.
     * @throws ReferenceEngineException when the configured strategy id is unknown.
     */
    @Builder
    public ReferenceEngine(
            MatchingRuntimeConfig matchingRuntimeConfig,
            LineClassifier lineClassifier
    ) {
        MatchingRuntimeBinder.Binding binding = new MatchingRuntimeBinder().bind(
                matchingRuntimeConfig,
                AdmissionStrategyRegistry.defaultRegistry()
        );
        this.admissionStrategy = binding.getAdmissionStrategy();
        this.resolverOrder = binding.getResolverOrder();
        this.lineClassifier = lineClassifier == null ? new LineClassifier() : lineClassifier;
    }

    /**
     * Creates an engine with default runtime configuration.
     */
    public static ReferenceEngine defaults() {
        return ReferenceEngine.builder().build();
    }

    /**
     * Runs all stages over a UTF-8 configuration file.
     */
    public RunOutcome run(Path path, List<String> addresses) {
        return run(new FileLineSource(path), addresses);
    }

    /**
     * Runs all stages over a configuration source.
     *
     * @param source re-openable line source.
     * @param addresses ordered target address names.
     * @return aggregated outcome; never null.
     */
    public RunOutcome run(LineSource source, List<String> addresses) {
        Objects.requireNonNull(source, "source");
        results = new ResultTable();

        TargetCatalog targets;
        try {
            targets = TargetCatalog.of(addresses);
        } catch (ReferenceEngineException ex) {
            log.error("rejected target list: {}", ex.getMessage());
            return RunOutcome.builder()
                    .status(StageStatus.FATAL)
                    .reasonCode(ex.getReasonCode())
                    .message(ex.getMessage())
                    .build();
        }

        ResultTable table = new ResultTable();
        for (String address : targets.names()) {
            table.record(address);
        }
        ScanContext context = ScanContext.builder()
                .source(source)
                .targets(targets)
                .results(table)
                .classifier(lineClassifier)
                .admissionStrategy(admissionStrategy)
                .ipNetmaskIndex(new IpNetmaskIndex())
                .build();

        RunOutcome.RunOutcomeBuilder outcome = RunOutcome.builder().addresses(targets.names());
        StageOutcome primary = runPrimary(context);
        outcome.stage(primary);
        if (primary.status() == StageStatus.FATAL) {
            return outcome
                    .status(StageStatus.FATAL)
                    .reasonCode(primary.reasonCode())
                    .message(primary.message())
                    .build();
        }

        StageStatus status = StageStatus.SUCCEEDED;
        for (ResolverStage stage : resolverStages()) {
            StageOutcome stageOutcome = runResolver(stage, context);
            outcome.stage(stageOutcome);
            if (stageOutcome.status() != StageStatus.SUCCEEDED) {
                status = StageStatus.DEGRADED;
            }
        }

        table.seal();
        results = table;
        return outcome.status(status).build();
    }

    /**
     * Returns the read-only result record of {@code address} from the last run.
     * Addresses that were not targets of a successful run get an empty record.
     * Mutators of the returned record throw {@link UnsupportedOperationException}.
     */
    public AddressResult resultRecord(String address) {
        AddressResult result = results.lookup(address);
        if (result == null) {
            result = new AddressResult(address);
            result.seal();
        }
        return result;
    }

    /**
     * Returns the category view of {@code address} from the last run.
     */
    public Map<ReportCategory, List<String>> format(String address) {
        return reportAssembler.format(resultRecord(address));
    }

    /**
     * Returns every record of the last run in target order.
     */
    public List<AddressResult> resultRecords() {
        return results.records();
    }

    public AdmissionStrategy admissionStrategy() {
        return admissionStrategy;
    }

    public ResolverOrder resolverOrder() {
        return resolverOrder;
    }

    /**
     * Resolver stages in execution order. With {@link ResolverOrder#COMPATIBLE} the
     * indirect stage only sees groups found by the primary scan, so rules naming a
     * group discovered through nesting are missed.
     */
    List<ResolverStage> resolverStages() {
        return switch (resolverOrder) {
            case COMPATIBLE -> List.of(
                    new RedundancyDetector(),
                    new IndirectReferenceResolver(),
                    new NestedGroupResolver()
            );
            case NESTED_BEFORE_INDIRECT -> List.of(
                    new RedundancyDetector(),
                    new NestedGroupResolver(),
                    new IndirectReferenceResolver()
            );
        };
    }

    private StageOutcome runPrimary(ScanContext context) {
        String input = context.getSource().describe();
        try {
            int admitted = primaryScanner.scan(context);
            return StageOutcome.succeeded(ScanStage.PRIMARY_SCAN, admitted);
        } catch (NoSuchFileException | FileNotFoundException ex) {
            log.error("configuration input not found: {}", input);
            return StageOutcome.fatal(ScanStage.PRIMARY_SCAN, REASON_INPUT_NOT_FOUND,
                    "configuration input not found: " + input);
        } catch (IOException | UncheckedIOException ex) {
            log.error("failed reading configuration input {}", input, ex);
            return StageOutcome.fatal(ScanStage.PRIMARY_SCAN, REASON_INPUT_READ_ERROR,
                    "failed reading configuration input " + input + ": " + ex.getMessage());
        }
    }

    private static StageOutcome runResolver(ResolverStage stage, ScanContext context) {
        try {
            int added = stage.resolve(context);
            log.debug("stage {} added {} facts", stage.stage(), added);
            return StageOutcome.succeeded(stage.stage(), added);
        } catch (IOException | RuntimeException ex) {
            log.warn("stage {} failed, keeping earlier results: {}", stage.stage(), ex.toString());
            return StageOutcome.degraded(stage.stage(), REASON_RESOLVER_FAILED,
                    stage.stage() + " failed: " + ex.getMessage());
        }
    }
}
