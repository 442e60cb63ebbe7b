package org.gts3.atlantis.stuckpoint.callgraph;

import java.util.List;

import org.gts3.atlantis.stuckpoint.AnalysisException;
import org.gts3.atlantis.stuckpoint.program.MethodSignature;

/**
 * Thrown when an under-specified entry point matches more than one method.
 */
public class AmbiguousEntryPointException extends AnalysisException {
    private final EntryPointSpec entryPoint;
    private final List<MethodSignature> candidates;

    public AmbiguousEntryPointException(EntryPointSpec entryPoint, List<MethodSignature> candidates) {
        super("Entry point " + entryPoint + " is ambiguous, add the parameter types to pick one of: " + candidates);
        this.entryPoint = entryPoint;
        this.candidates = List.copyOf(candidates);
    }

    public EntryPointSpec getEntryPoint() {
        return entryPoint;
    }

    public List<MethodSignature> getCandidates() {
        return candidates;
    }
}
