package org.gts3.atlantis.stuckpoint.callgraph;

import org.gts3.atlantis.stuckpoint.AnalysisException;

/**
 * Thrown when an entry point does not name a method with a body in the analysed program.
 */
public class EntryPointNotFoundException extends AnalysisException {
    private final EntryPointSpec entryPoint;

    public EntryPointNotFoundException(EntryPointSpec entryPoint, String reason) {
        super("Entry point " + entryPoint + " not found: " + reason);
        this.entryPoint = entryPoint;
    }

    public EntryPointSpec getEntryPoint() {
        return entryPoint;
    }
}
