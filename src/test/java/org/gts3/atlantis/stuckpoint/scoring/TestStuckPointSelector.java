package org.gts3.atlantis.stuckpoint.scoring;

import java.util.List;

import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;
import org.junit.jupiter.api.Test;

import static org.gts3.atlantis.stuckpoint.SamplePrograms.full;
import static org.gts3.atlantis.stuckpoint.SamplePrograms.none;
import static org.gts3.atlantis.stuckpoint.SamplePrograms.partly;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

public class TestStuckPointSelector {

    @Test
    public void testSelectsOnlyPartlyCoveredLinesInLocationOrder() {
        CoverageTable.Builder builder = CoverageTable.builder();
        builder.add(partly("demo.Z", 3));
        builder.add(full("demo.A", 1));
        builder.add(partly("demo.A", 40));
        builder.add(none("demo.A", 41));
        builder.add(partly("demo.A", 7));

        List<CoverageLine> selected = new StuckPointSelector().select(builder.build());

        assertThat(selected, contains(partly("demo.A", 7), partly("demo.A", 40), partly("demo.Z", 3)));
    }

    @Test
    public void testNoStuckPoints() {
        CoverageTable.Builder builder = CoverageTable.builder();
        builder.add(full("demo.A", 1));
        builder.add(none("demo.A", 2));

        assertThat(new StuckPointSelector().select(builder.build()), empty());
        assertThat(new StuckPointSelector().select(CoverageTable.empty()), empty());
    }
}
