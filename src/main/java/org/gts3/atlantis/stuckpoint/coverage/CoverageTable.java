package org.gts3.atlantis.stuckpoint.coverage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only coverage snapshot, indexed by class name and line number.
 *
 * A table is built once per run and then shared between all scoring threads without locking.
 */
public final class CoverageTable {
    private static final CoverageTable EMPTY = new Builder().build();

    private final Map<String, Map<Integer, CoverageLine>> lines;
    private final int size;

    private CoverageTable(Map<String, Map<Integer, CoverageLine>> lines, int size) {
        this.lines = lines;
        this.size = size;
    }

    public static CoverageTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a line.
     *
     * @return The coverage line, or null if the class or line is not part of the snapshot
     */
    public CoverageLine find(String classFqn, int lineNumber) {
        Map<Integer, CoverageLine> classLines = lines.get(classFqn);
        return classLines == null ? null : classLines.get(lineNumber);
    }

    public boolean isFullyCovered(String classFqn, int lineNumber) {
        CoverageLine line = find(classFqn, lineNumber);
        return line != null && line.getStatus() == CoverageStatus.FULLY_COVERED;
    }

    /**
     * Returns all lines, grouped by class and ordered by line number within a class.
     */
    public List<CoverageLine> lines() {
        List<CoverageLine> result = new ArrayList<>(size);
        for (Map<Integer, CoverageLine> classLines : lines.values()) {
            result.addAll(classLines.values());
        }
        return result;
    }

    public Set<String> classNames() {
        return lines.keySet();
    }

    public int size() {
        return size;
    }

    public int classCount() {
        return lines.size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Collects lines into a table. A builder is not thread-safe.
     */
    public static final class Builder {
        private final Map<String, TreeMap<Integer, CoverageLine>> lines = new HashMap<>();
        private int size;

        private Builder() {
        }

        /**
         * Adds a line unless the same class and line number is already present.
         *
         * @return true if the line was added, false if it was a duplicate
         */
        public boolean add(CoverageLine line) {
            TreeMap<Integer, CoverageLine> classLines = lines.computeIfAbsent(line.getClassFqn(), k -> new TreeMap<>());
            if (classLines.containsKey(line.getLineNumber())) {
                return false;
            }
            classLines.put(line.getLineNumber(), line);
            size++;
            return true;
        }

        public CoverageTable build() {
            Map<String, Map<Integer, CoverageLine>> frozen = new TreeMap<>();
            for (Map.Entry<String, TreeMap<Integer, CoverageLine>> entry : lines.entrySet()) {
                frozen.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
            }
            return new CoverageTable(Collections.unmodifiableMap(frozen), size);
        }
    }
}
