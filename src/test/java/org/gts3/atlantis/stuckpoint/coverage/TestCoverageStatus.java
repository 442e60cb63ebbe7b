package org.gts3.atlantis.stuckpoint.coverage;

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestCoverageStatus {

    @Test
    public void testClassifiesBoundaries() {
        assertEquals(CoverageStatus.NOT_COVERED, CoverageStatus.classify(0, 0));
        assertEquals(CoverageStatus.NOT_COVERED, CoverageStatus.classify(0, 5));
        assertEquals(CoverageStatus.PARTLY_COVERED, CoverageStatus.classify(1, 5));
        assertEquals(CoverageStatus.PARTLY_COVERED, CoverageStatus.classify(4, 5));
        assertEquals(CoverageStatus.FULLY_COVERED, CoverageStatus.classify(5, 5));
        assertEquals(CoverageStatus.FULLY_COVERED, CoverageStatus.classify(1, 1));
    }

    @Test
    public void testClassificationMatchesRuleForRandomCounters() {
        Random random = new Random(0x5eedL);
        for (int i = 0; i < 10_000; i++) {
            int total = random.nextInt(200);
            int covered = total == 0 ? 0 : random.nextInt(total + 1);

            CoverageStatus expected;
            if (total > 0 && covered == total) {
                expected = CoverageStatus.FULLY_COVERED;
            } else if (covered == 0) {
                expected = CoverageStatus.NOT_COVERED;
            } else {
                expected = CoverageStatus.PARTLY_COVERED;
            }

            CoverageLine line = new CoverageLine("a.B", "B.java", 1 + random.nextInt(1000), total, covered, 0, 0);
            assertEquals(expected, line.getStatus(), "covered=" + covered + ", total=" + total);
        }
    }
}
