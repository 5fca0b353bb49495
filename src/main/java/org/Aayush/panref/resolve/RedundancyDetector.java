package org.Aayush.panref.resolve;

import org.Aayush.panref.core.ScanContext;
import org.Aayush.panref.core.ScanStage;
import org.Aayush.panref.core.TargetCatalog;
import org.Aayush.panref.model.AddressDefinition;
import org.Aayush.panref.model.AddressResult;
import org.Aayush.panref.model.RedundantAddress;

import java.util.List;
import java.util.Map;

/**
 * Flags other address objects defined with the same IP/netmask as a target.
 *
 * <p>Works from the index built by the primary scan; no re-scan. Each peer is
 * annotated with the scope of its own defining line.</p>
 */
public final class RedundancyDetector implements ResolverStage {

    @Override
    public ScanStage stage() {
        return ScanStage.REDUNDANCY;
    }

    @Override
    public int resolve(ScanContext context) {
        TargetCatalog targets = context.getTargets();
        int added = 0;
        for (Map.Entry<String, List<AddressDefinition>> entry : context.getIpNetmaskIndex().sharedValues().entrySet()) {
            List<AddressDefinition> definitions = entry.getValue();
            for (String target : targets.names()) {
                if (!definesName(definitions, target)) {
                    continue;
                }
                AddressResult result = context.result(target);
                for (AddressDefinition peer : definitions) {
                    if (peer.name().equals(target)) {
                        continue;
                    }
                    result.addRedundantAddress(new RedundantAddress(
                            peer.name(),
                            entry.getKey(),
                            context.getClassifier().definitionScope(peer.line())
                    ));
                    added++;
                }
            }
        }
        return added;
    }

    private static boolean definesName(List<AddressDefinition> definitions, String name) {
        for (AddressDefinition definition : definitions) {
            if (definition.name().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
