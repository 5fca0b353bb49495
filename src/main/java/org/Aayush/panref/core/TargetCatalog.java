package org.Aayush.panref.core;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Ordered, duplicate-free catalogue of target address names.
 *
 * <p>Names keep the caller's order and are matched exactly: no trimming and no
 * case folding. Dense indexes follow that order.</p>
 */
public final class TargetCatalog {
    private final Object2IntOpenHashMap<String> indexByName;
    private final String[] names;

    private TargetCatalog(List<String> orderedNames) {
        this.names = orderedNames.toArray(new String[0]);
        this.indexByName = new Object2IntOpenHashMap<>(names.length);
        this.indexByName.defaultReturnValue(-1);
        for (int i = 0; i < names.length; i++) {
            indexByName.put(names[i], i);
        }
        this.indexByName.trim();
    }

    /**
     * Builds a catalogue from caller-supplied names, dropping repeated names.
     *
     * @throws ReferenceEngineException when the list is empty or holds a null/blank name.
     */
    public static TargetCatalog of(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new ReferenceEngineException(
                    ReferenceEngine.REASON_TARGETS_REQUIRED,
                    "at least one target address is required"
            );
        }
        List<String> ordered = new ArrayList<>(addresses.size());
        ObjectOpenHashSet<String> seen = new ObjectOpenHashSet<>(addresses.size());
        for (String address : addresses) {
            if (address == null || address.isBlank()) {
                throw new ReferenceEngineException(
                        ReferenceEngine.REASON_INVALID_TARGET,
                        "target address names must be non-blank"
                );
            }
            if (seen.add(address)) {
                ordered.add(address);
            }
        }
        return new TargetCatalog(ordered);
    }

    public int size() {
        return names.length;
    }

    public String name(int index) {
        try {
            return names[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("target index out of bounds: " + index);
        }
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Returns the dense index of a target, or -1 when not a target.
     */
    public int indexOf(String name) {
        return indexByName.getInt(name);
    }

    /**
     * Returns target names in catalogue order.
     */
    public List<String> names() {
        return List.copyOf(Arrays.asList(names));
    }
}
