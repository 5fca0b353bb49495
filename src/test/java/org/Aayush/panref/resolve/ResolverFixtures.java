package org.Aayush.panref.resolve;

import org.Aayush.panref.classify.LineClassifier;
import org.Aayush.panref.core.IpNetmaskIndex;
import org.Aayush.panref.core.LineSource;
import org.Aayush.panref.core.ResultTable;
import org.Aayush.panref.core.ScanContext;
import org.Aayush.panref.core.TargetCatalog;
import org.Aayush.panref.traits.matching.SubstringAdmissionStrategy;

import java.util.List;

final class ResolverFixtures {

    private ResolverFixtures() {
    }

    static ScanContext context(LineSource source, String... targets) {
        return ScanContext.builder()
                .source(source)
                .targets(TargetCatalog.of(List.of(targets)))
                .results(new ResultTable())
                .classifier(new LineClassifier())
                .admissionStrategy(new SubstringAdmissionStrategy())
                .ipNetmaskIndex(new IpNetmaskIndex())
                .build();
    }
}
