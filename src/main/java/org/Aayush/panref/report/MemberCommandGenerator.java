package org.Aayush.panref.report;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.model.AddressGroupDescriptor;
import org.Aayush.panref.model.AddressResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generates CLI statements adding a new member to every address group found for
 * a set of result records.
 *
 * <p>Reads the structured groups of each record, so the report layout can change
 * freely.</p>
 */
@Slf4j
public final class MemberCommandGenerator {

    /**
     * Builds one {@code ... address-group <name> member <new>} statement per distinct group.
     *
     * @param results records whose address groups should receive the member.
     * @param newAddress address object name to add.
     * @return statements in record then group order, without duplicates.
     */
    public List<String> addMemberCommands(Collection<AddressResult> results, String newAddress) {
        String member = requireName(newAddress);
        Set<String> commands = new LinkedHashSet<>();
        for (AddressResult result : Objects.requireNonNull(results, "results")) {
            for (AddressGroupDescriptor group : result.addressGroups()) {
                commands.add(group.commandPrefix() + " " + group.name() + " member " + member);
            }
        }
        return List.copyOf(commands);
    }

    /**
     * Returns the conventional command file name for a new member.
     */
    public static String commandFileName(String newAddress) {
        return "add_" + requireName(newAddress) + "_commands.txt";
    }

    /**
     * Writes {@code commands} with a short header into {@code directory}.
     *
     * @return path of the written file.
     */
    public Path writeCommandFile(Path directory, String newAddress, List<String> commands) throws IOException {
        Path file = Objects.requireNonNull(directory, "directory").resolve(commandFileName(newAddress));
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("# CLI commands to add '" + newAddress + "' to address groups\n");
            out.write("# Total commands: " + commands.size() + "\n\n");
            for (String command : commands) {
                out.write(command + "\n");
            }
        }
        log.info("wrote {} member commands to {}", commands.size(), file);
        return file;
    }

    private static String requireName(String newAddress) {
        String name = Objects.requireNonNull(newAddress, "newAddress").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("newAddress must be non-blank");
        }
        return name;
    }
}
