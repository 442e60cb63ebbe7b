package org.gts3.atlantis.stuckpoint.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored stuck points from most to least promising.
 */
public class ResultRanker {
    /**
     * Score descending, then class name and line number ascending. Total over distinct locations.
     */
    public static final Comparator<ScoredStuckPoint> RANKING = Comparator
            .comparingInt(ScoredStuckPoint::getScore).reversed()
            .thenComparing(ScoredStuckPoint::getClassFqn)
            .thenComparingInt(ScoredStuckPoint::getLineNumber);

    public List<ScoredStuckPoint> rank(Collection<ScoredStuckPoint> scored) {
        List<ScoredStuckPoint> ranked = new ArrayList<>(scored);
        ranked.sort(RANKING);
        return List.copyOf(ranked);
    }
}
