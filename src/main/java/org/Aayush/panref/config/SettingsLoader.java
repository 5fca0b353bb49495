package org.Aayush.panref.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.traits.matching.ResolverOrder;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads {@link ScanSettings} from a JSON document.
 *
 * <p>A missing, unreadable or malformed file degrades to {@link ScanSettings#empty()}
 * with a warning; loading never fails the caller. {@code address_name} accepts a
 * comma-separated string or an array of strings.</p>
 */
@Slf4j
public final class SettingsLoader {
    public static final String REASON_CONFIG_LOAD_FAILED = "CONFIG_LOAD_FAILED";

    static final String FIELD_LOG_FILE = "log_file";
    static final String FIELD_ADDRESS_NAME = "address_name";
    static final String FIELD_OUTPUT_FILE = "output_file";
    static final String FIELD_MATCHING_STRATEGY = "matching_strategy";
    static final String FIELD_RESOLVER_ORDER = "resolver_order";

    private final ObjectMapper objectMapper;

    public SettingsLoader() {
        this(new ObjectMapper());
    }

    public SettingsLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Loads settings from {@code path}, or empty settings when it cannot be loaded.
     */
    public ScanSettings load(Path path) {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(objectMapper.readTree(reader));
        } catch (NoSuchFileException ex) {
            log.warn("[{}] settings file {} not found, using empty settings", REASON_CONFIG_LOAD_FAILED, path);
        } catch (JsonProcessingException ex) {
            log.warn("[{}] settings file {} is not valid JSON, using empty settings: {}",
                    REASON_CONFIG_LOAD_FAILED, path, ex.getOriginalMessage());
        } catch (IOException ex) {
            log.warn("[{}] cannot read settings file {}, using empty settings: {}",
                    REASON_CONFIG_LOAD_FAILED, path, ex.getMessage());
        }
        return ScanSettings.empty();
    }

    /**
     * Parses settings from JSON text, or empty settings when the text is malformed.
     */
    public ScanSettings loadFromString(String json) {
        try {
            return parse(objectMapper.readTree(Objects.requireNonNull(json, "json")));
        } catch (JsonProcessingException ex) {
            log.warn("[{}] settings are not valid JSON, using empty settings: {}",
                    REASON_CONFIG_LOAD_FAILED, ex.getOriginalMessage());
            return ScanSettings.empty();
        }
    }

    private static ScanSettings parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            log.warn("[{}] settings root must be a JSON object, using empty settings", REASON_CONFIG_LOAD_FAILED);
            return ScanSettings.empty();
        }
        return ScanSettings.builder()
                .logFile(text(root, FIELD_LOG_FILE))
                .addresses(addresses(root.get(FIELD_ADDRESS_NAME)))
                .outputFile(text(root, FIELD_OUTPUT_FILE))
                .matchingStrategy(text(root, FIELD_MATCHING_STRATEGY))
                .resolverOrder(resolverOrder(text(root, FIELD_RESOLVER_ORDER)))
                .build();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    /**
     * Splits a comma-separated string or flattens an array, trimming entries and
     * dropping blanks.
     */
    static List<String> addresses(JsonNode node) {
        List<String> addresses = new ArrayList<>();
        if (node == null || node.isNull()) {
            return addresses;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                addIfPresent(addresses, element.asText());
            }
        } else if (node.isValueNode()) {
            for (String part : node.asText().split(",")) {
                addIfPresent(addresses, part);
            }
        }
        return addresses;
    }

    private static void addIfPresent(List<String> addresses, String candidate) {
        String trimmed = candidate.trim();
        if (!trimmed.isEmpty()) {
            addresses.add(trimmed);
        }
    }

    private static ResolverOrder resolverOrder(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ResolverOrder.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.warn("[{}] unknown resolver_order '{}', using default", REASON_CONFIG_LOAD_FAILED, value);
            return null;
        }
    }
}
