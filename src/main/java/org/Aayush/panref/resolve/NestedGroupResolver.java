package org.Aayush.panref.resolve;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.panref.core.ScanContext;
import org.Aayush.panref.core.ScanStage;
import org.Aayush.panref.core.TargetCatalog;
import org.Aayush.panref.model.AddressGroupDescriptor;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Attaches outer groups whose members include an inner group containing a target.
 *
 * <p>Resolves exactly one level: for {@code G1 ⊃ {G2}, G2 ⊃ {x}} target {@code x}
 * gains {@code G1}; for {@code G1 ⊃ {G2}, G2 ⊃ {G3}, G3 ⊃ {x}} it does not.</p>
 */
@Slf4j
public final class NestedGroupResolver implements ResolverStage {

    @Override
    public ScanStage stage() {
        return ScanStage.NESTED_GROUPS;
    }

    @Override
    public int resolve(ScanContext context) throws IOException {
        GroupCatalogue catalogue = catalogue(context);
        TargetCatalog targets = context.getTargets();

        int added = 0;
        for (GroupCatalogue.Entry outer : catalogue.entries()) {
            Set<String> relevant = new LinkedHashSet<>();
            for (String member : outer.members()) {
                GroupCatalogue.Entry inner = catalogue.entry(member);
                if (inner != null) {
                    for (String target : targets.names()) {
                        if (inner.members().contains(target)) {
                            relevant.add(target);
                        }
                    }
                }
                if (targets.contains(member)) {
                    log.debug("group {} lists target {} directly", outer.group().name(), member);
                    relevant.add(member);
                }
            }
            for (String target : relevant) {
                if (context.result(target).addAddressGroup(outer.group())) {
                    added++;
                }
            }
        }
        return added;
    }

    /**
     * Re-scans the source and catalogues every address-group definition.
     */
    static GroupCatalogue catalogue(ScanContext context) throws IOException {
        GroupCatalogue catalogue = new GroupCatalogue();
        context.forEachLine(line -> {
            AddressGroupDescriptor group = context.getClassifier().addressGroup(line);
            if (group != null) {
                catalogue.define(group);
            }
        });
        log.debug("catalogued {} address groups", catalogue.size());
        return catalogue;
    }
}
