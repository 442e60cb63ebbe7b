package org.gts3.atlantis.stuckpoint.scoring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;

/**
 * Picks the stuck points of a coverage snapshot: lines the fuzzer reached but did not fully execute.
 */
public class StuckPointSelector {
    static final Comparator<CoverageLine> BY_LOCATION =
            Comparator.comparing(CoverageLine::getClassFqn).thenComparingInt(CoverageLine::getLineNumber);

    /**
     * @return The partly covered lines, ordered by class name and line number
     */
    public List<CoverageLine> select(CoverageTable table) {
        List<CoverageLine> stuckPoints = new ArrayList<>();
        for (CoverageLine line : table.lines()) {
            if (line.isStuckPoint()) {
                stuckPoints.add(line);
            }
        }
        stuckPoints.sort(BY_LOCATION);
        return stuckPoints;
    }
}
