package org.Aayush.panref.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.panref.classify.LineClassifier;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.traits.matching.AdmissionStrategy;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * State shared by the primary scan and the resolver stages of one run.
 */
@Value
@Builder
public class ScanContext {
    LineSource source;
    TargetCatalog targets;
    ResultTable results;
    LineClassifier classifier;
    AdmissionStrategy admissionStrategy;
    IpNetmaskIndex ipNetmaskIndex;

    public AddressResult result(String address) {
        return results.record(address);
    }

    /**
     * Streams every trimmed, non-empty line of the source once, closing it afterwards.
     */
    public void forEachLine(Consumer<String> visitor) throws IOException {
        try (BufferedReader reader = source.open()) {
            String raw;
            while ((raw = reader.readLine()) != null) {
                String line = raw.strip();
                if (!line.isEmpty()) {
                    visitor.accept(line);
                }
            }
        }
    }
}
