package org.Aayush.panref.resolve;

import org.Aayush.panref.core.ScanContext;
import org.Aayush.panref.core.ScanStage;

import java.io.IOException;

/**
 * One secondary stage deriving facts that no single line shows on its own.
 *
 * <p>Stages run after the primary scan and only add to the result table. A failing
 * stage is reported as degraded by the engine; facts it added before failing and
 * facts of earlier stages are kept.</p>
 */
public interface ResolverStage {

    /**
     * Stage identity used in outcomes and logs.
     */
    ScanStage stage();

    /**
     * Resolves and merges facts into the context's result table.
     *
     * @return number of facts added.
     * @throws IOException when a re-scan of the source fails.
     */
    int resolve(ScanContext context) throws IOException;
}
