package org.Aayush.panref.resolve;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.Aayush.panref.classify.MemberListParser;
import org.Aayush.panref.model.AddressGroupDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Catalogue of every address-group definition in a configuration, keyed by name.
 *
 * <p>A later definition of the same name replaces the earlier one but keeps its
 * position.</p>
 */
public final class GroupCatalogue {
    private final Object2ObjectLinkedOpenHashMap<String, Entry> entriesByName = new Object2ObjectLinkedOpenHashMap<>();

    public void define(AddressGroupDescriptor group) {
        Objects.requireNonNull(group, "group");
        entriesByName.put(group.name(), new Entry(group, MemberListParser.parse(group.definition())));
    }

    /**
     * Returns the entry for a group name, or null when no such group is defined.
     */
    public Entry entry(String groupName) {
        return entriesByName.get(groupName);
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entriesByName.values());
    }

    public int size() {
        return entriesByName.size();
    }

    /**
     * One catalogued group and its parsed member tokens.
     */
    public record Entry(AddressGroupDescriptor group, List<String> members) {
    }
}
