package org.Aayush.panref.report;

import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.IndirectRuleContext;
import org.Aayush.panref.model.RedundantAddress;
import org.Aayush.panref.model.RuleContext;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Renders result records into a structured plain-text report.
 *
 * <p>One section per {@link ReportCategory}; security rules are grouped by device
 * group in sorted order. Address groups carry their reconstructed definition
 * command. Consumers that need groups should read {@link AddressResult#addressGroups()}
 * rather than parse this text.</p>
 */
public final class ReportWriter {
    static final String RULE = "# ===============================================================";
    static final String NONE = "  None discovered";

    private final ReportAssembler assembler;

    public ReportWriter() {
        this(new ReportAssembler());
    }

    public ReportWriter(ReportAssembler assembler) {
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * Writes a report covering {@code results} to {@code path}, replacing any existing file.
     */
    public void write(Path path, List<AddressResult> results) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(out, results);
        }
    }

    /**
     * Writes a report covering {@code results} to {@code out}. The writer is not closed.
     */
    public void write(Writer out, List<AddressResult> results) throws IOException {
        Objects.requireNonNull(out, "out");
        for (AddressResult result : Objects.requireNonNull(results, "results")) {
            writeAddress(out, result);
        }
        out.write(RULE + "\n");
        out.write("# Analysis Complete\n");
        out.write(RULE + "\n");
        out.flush();
    }

    /**
     * Counts the items of every category of one record.
     */
    public int relationshipCount(AddressResult result) {
        int total = 0;
        for (List<String> items : assembler.format(result).values()) {
            total += items.size();
        }
        return total;
    }

    private void writeAddress(Writer out, AddressResult result) throws IOException {
        Map<ReportCategory, List<String>> view = assembler.format(result);
        List<String> lines = result.matchingLines();

        out.write(RULE + "\n");
        out.write("# Address Reference Report\n");
        out.write(RULE + "\n");
        out.write("# Target Address Object: " + result.address() + "\n");
        out.write("# Configuration Lines Found: " + lines.size() + "\n");
        out.write("# Total Relationships: " + relationshipCount(result) + "\n");
        out.write(RULE + "\n\n");

        out.write("# MATCHING CONFIGURATION LINES\n");
        out.write("# Found " + lines.size() + " lines containing '" + result.address() + "'\n");
        out.write("---\n\n");
        if (lines.isEmpty()) {
            out.write("  # No matching lines found\n");
        }
        for (int i = 0; i < lines.size(); i++) {
            out.write(String.format("  %2d. %s", i + 1, lines.get(i)) + "\n");
        }

        for (Map.Entry<ReportCategory, List<String>> category : view.entrySet()) {
            int count = category.getValue().size();
            out.write("\n# " + category.getKey().label().toUpperCase() + "\n");
            out.write("# Found: " + count + " item" + (count == 1 ? "" : "s") + "\n");
            out.write("---\n");
            if (count == 0) {
                out.write(NONE + "\n");
            } else {
                switch (category.getKey()) {
                    case DIRECT_SECURITY_RULES -> writeRules(out, directRulesByDeviceGroup(result));
                    case INDIRECT_SECURITY_RULES -> writeRules(out, indirectRulesByDeviceGroup(result));
                    case ADDRESS_GROUPS -> writeGroups(out, result.addressGroups());
                    case REDUNDANT_ADDRESSES -> writeRedundant(out, result.redundantAddresses());
                    default -> writeItems(out, category.getValue());
                }
            }
            out.write("\n");
        }
    }

    private static Map<String, List<String[]>> directRulesByDeviceGroup(AddressResult result) {
        Map<String, List<String[]>> byDeviceGroup = new TreeMap<>();
        for (Map.Entry<String, String> rule : result.directRules().entrySet()) {
            RuleContext context = result.directRuleContexts().getOrDefault(rule.getKey(), RuleContext.DIRECT_REFERENCE);
            byDeviceGroup.computeIfAbsent(rule.getValue(), dg -> new ArrayList<>())
                    .add(new String[]{rule.getKey(), context.description()});
        }
        return byDeviceGroup;
    }

    private static Map<String, List<String[]>> indirectRulesByDeviceGroup(AddressResult result) {
        Map<String, List<String[]>> byDeviceGroup = new TreeMap<>();
        for (Map.Entry<String, String> rule : result.indirectRules().entrySet()) {
            IndirectRuleContext context = result.indirectRuleContexts().get(rule.getKey());
            byDeviceGroup.computeIfAbsent(rule.getValue(), dg -> new ArrayList<>())
                    .add(new String[]{rule.getKey(), context == null ? "indirect reference" : context.describe()});
        }
        return byDeviceGroup;
    }

    private static void writeRules(Writer out, Map<String, List<String[]>> byDeviceGroup) throws IOException {
        for (Map.Entry<String, List<String[]>> deviceGroup : byDeviceGroup.entrySet()) {
            out.write("  " + deviceGroup.getKey() + ":\n");
            for (String[] rule : deviceGroup.getValue()) {
                out.write("    - " + rule[0] + "  # " + rule[1] + "\n");
            }
            out.write("\n");
        }
    }

    private static void writeGroups(Writer out, List<AddressGroupDescriptor> groups) throws IOException {
        int index = 1;
        for (AddressGroupDescriptor group : groups) {
            out.write("  " + index++ + ". " + ReportAssembler.groupItem(group) + "\n");
            out.write("     Command: " + group.definitionCommand() + "\n");
            out.write("     Members: " + group.definition() + "\n\n");
        }
    }

    private static void writeRedundant(Writer out, List<RedundantAddress> peers) throws IOException {
        out.write("  Address objects with identical IP configurations:\n\n");
        int index = 1;
        for (RedundantAddress peer : peers) {
            out.write("  " + index++ + ". " + peer.name() + "\n");
            out.write("     IP/Netmask: " + peer.ipNetmask() + "\n");
            out.write("     Scope: " + peer.deviceGroup() + "\n");
            out.write("     Note: Same IP as target address - potential duplicate\n\n");
        }
    }

    private static void writeItems(Writer out, List<String> items) throws IOException {
        for (int i = 0; i < items.size(); i++) {
            out.write("  " + (i + 1) + ". " + items.get(i) + "\n");
        }
    }
}
