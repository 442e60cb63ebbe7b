package org.gts3.atlantis.stuckpoint.fixtures;

public class TableHarness {

    public static void fuzzerTestOneInput(byte[] data) {
        if (data.length == 0) {
            return;
        }
        if (LookupTable.lookup(data[0]) > 100) {
            new Registry();
        }
    }
}
