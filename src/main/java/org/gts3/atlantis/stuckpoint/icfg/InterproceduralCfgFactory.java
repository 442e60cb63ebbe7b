package org.gts3.atlantis.stuckpoint.icfg;

import java.nio.file.Path;
import java.util.List;

import org.gts3.atlantis.stuckpoint.AnalysisException;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;

/**
 * Builds the interprocedural control-flow graph of a set of binaries, rooted at the fuzzer entry point.
 */
@FunctionalInterface
public interface InterproceduralCfgFactory {

    /**
     * @param binaries The jars, class directories and class files that make up the application
     * @param entryPoint The method the call graph is rooted at
     * @return A fully materialised, immutable graph
     * @throws AnalysisException If the program cannot be loaded at all or the entry point does not resolve
     */
    InterproceduralCfg load(List<Path> binaries, EntryPointSpec entryPoint) throws AnalysisException;
}
