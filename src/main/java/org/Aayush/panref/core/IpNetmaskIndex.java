package org.Aayush.panref.core;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.panref.model.AddressDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scan-scoped index from IP/netmask value to every address definition seen with it.
 *
 * <p>Holds all definitions, not only targets. Values and the definitions under
 * each keep file order.</p>
 */
public final class IpNetmaskIndex {
    private final Object2ObjectLinkedOpenHashMap<String, ObjectArrayList<AddressDefinition>> definitionsByValue =
            new Object2ObjectLinkedOpenHashMap<>();

    public void record(AddressDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        definitionsByValue
                .computeIfAbsent(definition.ipNetmask(), key -> new ObjectArrayList<>())
                .add(definition);
    }

    /**
     * Returns definitions sharing {@code ipNetmask}, empty when unknown.
     */
    public List<AddressDefinition> definitions(String ipNetmask) {
        ObjectArrayList<AddressDefinition> definitions = definitionsByValue.get(ipNetmask);
        return definitions == null ? List.of() : List.copyOf(definitions);
    }

    /**
     * Returns every value held by more than one definition, in first-seen order.
     */
    public Map<String, List<AddressDefinition>> sharedValues() {
        Map<String, List<AddressDefinition>> shared = new LinkedHashMap<>();
        for (Map.Entry<String, ObjectArrayList<AddressDefinition>> entry : definitionsByValue.entrySet()) {
            if (entry.getValue().size() > 1) {
                shared.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
        }
        return shared;
    }

    public int valueCount() {
        return definitionsByValue.size();
    }
}
