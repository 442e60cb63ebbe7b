package org.gts3.atlantis.stuckpoint.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.gts3.atlantis.stuckpoint.AnalyzerConfig;
import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_WARN;

/**
 * Scores many stuck points on a fixed pool of worker threads.
 *
 * Each stuck point is an independent task over the shared scorer. A task that fails is logged and
 * left out of the result without affecting the others.
 */
public class StuckPointScoringService {
    private static final int PROGRESS_INTERVAL = 10;

    private final AnalyzerConfig config;
    private final ReachabilityScorer scorer;

    public StuckPointScoringService(AnalyzerConfig config, ReachabilityScorer scorer) {
        this.config = config;
        this.scorer = scorer;
    }

    /**
     * Result of a scoring run: the scored points in input order and the number of failures.
     */
    public static final class Outcome {
        private final List<ScoredStuckPoint> scored;
        private final int failures;

        Outcome(List<ScoredStuckPoint> scored, int failures) {
            this.scored = List.copyOf(scored);
            this.failures = failures;
        }

        public List<ScoredStuckPoint> getScored() {
            return scored;
        }

        public int getFailures() {
            return failures;
        }
    }

    public Outcome scoreAll(List<CoverageLine> stuckPoints) {
        int threads = Math.min(config.getWorkerThreads(), Math.max(1, stuckPoints.size()));
        System.out.println("Scoring " + stuckPoints.size() + " stuck points with " + threads + " worker thread(s)");

        AtomicInteger done = new AtomicInteger();
        List<ScoredStuckPoint> scored = new ArrayList<>();
        int failures = 0;

        if (threads == 1) {
            for (CoverageLine stuckPoint : stuckPoints) {
                try {
                    scored.add(scoreOne(stuckPoint, done, stuckPoints.size()));
                } catch (RuntimeException e) {
                    failures++;
                    reportFailure(stuckPoint, e);
                }
            }
            return new Outcome(scored, failures);
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ScoredStuckPoint>> futures = new ArrayList<>();
            for (CoverageLine stuckPoint : stuckPoints) {
                futures.add(executor.submit(() -> scoreOne(stuckPoint, done, stuckPoints.size())));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    scored.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    failures++;
                    reportFailure(stuckPoints.get(i), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scoring stuck points", e);
        } finally {
            executor.shutdownNow();
        }
        return new Outcome(scored, failures);
    }

    private ScoredStuckPoint scoreOne(CoverageLine stuckPoint, AtomicInteger done, int total) {
        ScoredStuckPoint result = new ScoredStuckPoint(stuckPoint, scorer.score(stuckPoint));
        int finished = done.incrementAndGet();
        if (config.isVerbose() && (finished % PROGRESS_INTERVAL == 0 || finished == total)) {
            System.out.println("Scored " + finished + "/" + total + " stuck points");
        }
        return result;
    }

    private static void reportFailure(CoverageLine stuckPoint, Throwable cause) {
        System.err.println(LOG_WARN + "Failed to score " + stuckPoint.getClassFqn() + ":" + stuckPoint.getLineNumber() + ": " + cause);
        cause.printStackTrace();
    }
}
