package org.Aayush.panref.core;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.Aayush.panref.model.AddressResult;

import java.util.List;
import java.util.Objects;

/**
 * Per-run result table keyed by target address name.
 *
 * <p>Records are created with empty defaults on first touch and never removed
 * during a run. Iteration follows creation order.</p>
 */
public final class ResultTable {
    private final Object2ObjectLinkedOpenHashMap<String, AddressResult> records = new Object2ObjectLinkedOpenHashMap<>();

    /**
     * Returns the record for {@code address}, creating an empty one on first access.
     */
    public AddressResult record(String address) {
        return records.computeIfAbsent(Objects.requireNonNull(address, "address"), AddressResult::new);
    }

    /**
     * Returns the record for {@code address} without creating it, or null.
     */
    public AddressResult lookup(String address) {
        return records.get(address);
    }

    public boolean contains(String address) {
        return records.containsKey(address);
    }

    public List<AddressResult> records() {
        return List.copyOf(records.values());
    }

    public int size() {
        return records.size();
    }

    /**
     * Makes every record read-only. Called once the run that filled the table is over.
     */
    public void seal() {
        for (AddressResult result : records.values()) {
            result.seal();
        }
    }
}
