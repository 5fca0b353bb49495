package org.Aayush.app;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.config.ScanSettings;
import org.Aayush.panref.config.SettingsLoader;
import org.Aayush.panref.core.ReferenceEngine;
import org.Aayush.panref.core.ReferenceEngineException;
import org.Aayush.panref.core.RunOutcome;
import org.Aayush.panref.core.StageOutcome;
import org.Aayush.panref.core.StageStatus;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.report.AddressCopyPlan;
import org.Aayush.panref.report.AddressCopyPlanner;
import org.Aayush.panref.report.AddressCopyRequest;
import org.Aayush.panref.report.CleanupPlan;
import org.Aayush.panref.report.CleanupPlanner;
import org.Aayush.panref.report.CopyMode;
import org.Aayush.panref.report.MemberCommandGenerator;
import org.Aayush.panref.report.ReportCategory;
import org.Aayush.panref.report.ReportWriter;
import org.Aayush.panref.traits.matching.MatchingRuntimeConfig;
import org.Aayush.panref.traits.matching.ResolverOrder;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Non-interactive command-line entry point.
 *
 * <pre>
 * panref -a web1,web2 -l running-config.txt [-o report.txt] [-c settings.json]
 *        [-s SUBSTRING|TOKEN_BOUNDARY] [--nested-first] [-m new-address] [--cleanup]
 * panref -a web1 --copy-to web1-new --copy-ip 10.0.0.9/32 [--copy-mode add|replace]
 * </pre>
 *
 * <p>Command-line values win over settings-file values.</p>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final String DEFAULT_LOG_FILE = "default.log";

    private static final String USAGE = String.join("\n",
            "usage: panref -a <address[,address...]> [-l <config dump>] [-o <report>] [-c <settings.json>]",
            "              [-s <strategy>] [--nested-first] [-m <new address>] [--cleanup]",
            "              [--copy-to <name> --copy-ip <ip/netmask> [--copy-mode add|replace]]",
            "  -a, --address       address object name(s) to analyze, comma-separated",
            "  -l, --logfile       configuration dump to scan (default: " + DEFAULT_LOG_FILE + ")",
            "  -o, --output        report file; with several addresses one combined report",
            "  -c, --config        JSON settings file",
            "  -s, --strategy      line admission strategy: SUBSTRING (default) or TOKEN_BOUNDARY",
            "      --nested-first  resolve nested groups before indirect rules",
            "  -m, --add-member    write commands adding this address to every group found",
            "      --cleanup       write commands folding redundant addresses into each target",
            "      --copy-to       write commands creating a copy of the single target address",
            "      --copy-ip       IP/netmask of the copy",
            "      --copy-mode     add (default) keeps the source in place, replace swaps it out",
            "  -h, --help          show this help"
    );

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDirectory;

    Main(PrintStream out, PrintStream err, Path workingDirectory) {
        this.out = out;
        this.err = err;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Launches one analysis run.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int code = new Main(System.out, System.err, Paths.get("")).run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs the CLI and returns its exit code.
     */
    int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("error: " + ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        ScanSettings settings = options.config == null
                ? ScanSettings.empty()
                : new SettingsLoader().load(resolve(options.config));

        List<String> addresses = options.addresses.isEmpty() ? settings.getAddresses() : options.addresses;
        if (addresses.isEmpty()) {
            err.println("error: at least one address name is required");
            err.println(USAGE);
            return EXIT_USAGE;
        }
        AddressCopyRequest copyRequest = null;
        if (options.copyTo != null || options.copyIp != null) {
            try {
                copyRequest = copyRequest(options, addresses);
            } catch (IllegalArgumentException ex) {
                err.println("error: " + ex.getMessage());
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        String logFile = firstNonNull(options.logFile, settings.getLogFile(), DEFAULT_LOG_FILE);
        String outputFile = firstNonNull(options.output, settings.getOutputFile(), null);

        ReferenceEngine engine;
        try {
            engine = ReferenceEngine.builder()
                    .matchingRuntimeConfig(MatchingRuntimeConfig.builder()
                            .admissionStrategyId(firstNonNull(options.strategy, settings.getMatchingStrategy(), null))
                            .resolverOrder(options.nestedFirst ? ResolverOrder.NESTED_BEFORE_INDIRECT : settings.getResolverOrder())
                            .build())
                    .build();
        } catch (ReferenceEngineException ex) {
            err.println("error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        RunOutcome outcome = engine.run(resolve(logFile), addresses);
        if (!outcome.isSuccess()) {
            err.println("error: " + outcome.getMessage());
            return EXIT_RUN_FAILED;
        }
        for (StageOutcome stage : outcome.getStages()) {
            if (stage.status() == StageStatus.DEGRADED) {
                err.println("warning: " + stage.message());
            }
        }

        try {
            List<AddressResult> reported = writeReports(engine, outcome.getAddresses(), outputFile);
            if (options.addMember != null) {
                writeMemberCommands(reported, options.addMember);
            }
            if (copyRequest != null) {
                writeCopyCommands(engine.resultRecord(copyRequest.getSourceAddress()), copyRequest);
            }
            if (options.cleanup) {
                return writeCleanupCommands(engine, resolve(logFile), reported);
            }
        } catch (IllegalArgumentException ex) {
            err.println("error: " + ex.getMessage());
            return EXIT_RUN_FAILED;
        } catch (IOException ex) {
            log.error("failed writing output", ex);
            err.println("error: failed writing output: " + ex.getMessage());
            return EXIT_RUN_FAILED;
        }
        return EXIT_OK;
    }

    private List<AddressResult> writeReports(ReferenceEngine engine, List<String> addresses, String outputFile)
            throws IOException {
        ReportWriter writer = new ReportWriter();
        List<AddressResult> reported = new ArrayList<>();
        for (String address : addresses) {
            AddressResult result = engine.resultRecord(address);
            if (!result.hasMatches()) {
                out.println("No matches found for '" + address + "'");
                continue;
            }
            reported.add(result);
            if (outputFile == null) {
                Path target = resolve(address + "_results.txt");
                writer.write(target, List.of(result));
                out.println("Results written to " + target);
            }
            printSummary(engine.format(address));
        }
        if (outputFile != null && !reported.isEmpty()) {
            Path target = resolve(outputFile);
            writer.write(target, reported);
            out.println("Processed " + reported.size() + " out of " + addresses.size() + " addresses.");
            out.println("Results written to " + target);
        }
        return reported;
    }

    private void writeMemberCommands(List<AddressResult> reported, String newAddress) throws IOException {
        MemberCommandGenerator generator = new MemberCommandGenerator();
        List<String> commands = generator.addMemberCommands(reported, newAddress);
        if (commands.isEmpty()) {
            out.println("No address groups found for command generation");
            return;
        }
        Path file = generator.writeCommandFile(workingDirectory, newAddress, commands);
        out.println("Generated " + commands.size() + " commands, saved to " + file);
    }

    private void writeCopyCommands(AddressResult source, AddressCopyRequest request) throws IOException {
        AddressCopyPlanner planner = new AddressCopyPlanner();
        AddressCopyPlan plan = planner.plan(source, request);
        Path file = planner.writeCommandFile(workingDirectory, plan);
        out.println("Generated " + plan.totalCommands() + " copy commands, saved to " + file);
    }

    /**
     * Reruns the engine over the peers of every target with redundancies to learn
     * where they are used, then writes one cleanup file per target.
     */
    private int writeCleanupCommands(ReferenceEngine engine, Path logPath, List<AddressResult> reported)
            throws IOException {
        CleanupPlanner planner = new CleanupPlanner();
        for (AddressResult target : reported) {
            if (target.redundantAddresses().isEmpty()) {
                out.println("No redundant addresses found for '" + target.address() + "'");
                continue;
            }
            Set<String> peers = new LinkedHashSet<>();
            for (RedundantAddress peer : target.redundantAddresses()) {
                peers.add(peer.name());
            }
            RunOutcome usage = engine.run(logPath, new ArrayList<>(peers));
            if (!usage.isSuccess()) {
                err.println("error: " + usage.getMessage());
                return EXIT_RUN_FAILED;
            }
            Map<String, AddressResult> peerUsage = new LinkedHashMap<>();
            for (String peer : peers) {
                peerUsage.put(peer, engine.resultRecord(peer));
            }
            CleanupPlan plan = planner.plan(target, peerUsage);
            Path file = planner.writeCommandFile(workingDirectory, plan);
            out.println("Generated " + plan.getCommands().size() + " cleanup commands for '"
                    + target.address() + "', saved to " + file);
            if (plan.isPromoteToShared()) {
                out.println("  '" + target.address() + "' is recreated in shared scope");
            }
        }
        return EXIT_OK;
    }

    private static AddressCopyRequest copyRequest(Options options, List<String> addresses) {
        if (options.copyTo == null || options.copyIp == null) {
            throw new IllegalArgumentException("--copy-to and --copy-ip must be given together");
        }
        if (addresses.size() != 1) {
            throw new IllegalArgumentException("address copy needs exactly one source address");
        }
        AddressCopyRequest request = AddressCopyRequest.builder()
                .sourceAddress(addresses.get(0))
                .newAddress(options.copyTo)
                .newIpNetmask(options.copyIp)
                .mode(options.copyMode == null ? CopyMode.ADD : CopyMode.parse(options.copyMode))
                .build();
        request.validate();
        return request;
    }

    private void printSummary(Map<ReportCategory, List<String>> view) {
        for (Map.Entry<ReportCategory, List<String>> category : view.entrySet()) {
            int count = category.getValue().size();
            out.println("  " + category.getKey().label() + ": " + (count > 0 ? count + " found" : "none found"));
        }
    }

    private Path resolve(String file) {
        return workingDirectory.resolve(file);
    }

    private static String firstNonNull(String first, String second, String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }

    /**
     * Parsed command-line options.
     */
    static final class Options {
        final List<String> addresses = new ArrayList<>();
        String logFile;
        String output;
        String config;
        String strategy;
        String addMember;
        String copyTo;
        String copyIp;
        String copyMode;
        boolean cleanup;
        boolean nestedFirst;
        boolean help;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-a", "--address" -> splitAddresses(value(args, ++i, arg), options.addresses);
                    case "-l", "--logfile" -> options.logFile = value(args, ++i, arg);
                    case "-o", "--output" -> options.output = value(args, ++i, arg);
                    case "-c", "--config" -> options.config = value(args, ++i, arg);
                    case "-s", "--strategy" -> options.strategy = value(args, ++i, arg);
                    case "-m", "--add-member" -> options.addMember = value(args, ++i, arg);
                    case "--copy-to" -> options.copyTo = value(args, ++i, arg);
                    case "--copy-ip" -> options.copyIp = value(args, ++i, arg);
                    case "--copy-mode" -> options.copyMode = value(args, ++i, arg);
                    case "--cleanup" -> options.cleanup = true;
                    case "--nested-first" -> options.nestedFirst = true;
                    case "-h", "--help" -> options.help = true;
                    default -> throw new IllegalArgumentException("unknown option: " + arg);
                }
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("missing value for " + option);
            }
            return args[index];
        }

        private static void splitAddresses(String value, List<String> addresses) {
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    addresses.add(trimmed);
                }
            }
        }
    }
}
