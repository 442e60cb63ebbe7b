package org.gts3.atlantis.stuckpoint.program;

/**
 * Inclusive range of source lines a statement was compiled from.
 *
 * Statements without line information use {@link #NO_POSITION}, which contains no line.
 */
public final class LineSpan {
    public static final LineSpan NO_POSITION = new LineSpan(-1, -1);

    private final int firstLine;
    private final int lastLine;

    private LineSpan(int firstLine, int lastLine) {
        this.firstLine = firstLine;
        this.lastLine = lastLine;
    }

    /**
     * @throws IllegalArgumentException If {@code firstLine} is not positive or {@code lastLine < firstLine}
     */
    public static LineSpan of(int firstLine, int lastLine) {
        if (firstLine <= 0 || lastLine < firstLine) {
            throw new IllegalArgumentException("Invalid line span [" + firstLine + ", " + lastLine + "]");
        }
        return new LineSpan(firstLine, lastLine);
    }

    public static LineSpan single(int line) {
        return of(line, line);
    }

    public boolean hasPosition() {
        return this != NO_POSITION;
    }

    public int getFirstLine() {
        return firstLine;
    }

    public int getLastLine() {
        return lastLine;
    }

    public boolean contains(int line) {
        return hasPosition() && line >= firstLine && line <= lastLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineSpan)) return false;
        LineSpan that = (LineSpan) o;
        return firstLine == that.firstLine && lastLine == that.lastLine;
    }

    @Override
    public int hashCode() {
        return 31 * firstLine + lastLine;
    }

    @Override
    public String toString() {
        if (!hasPosition()) {
            return "[no position]";
        }
        return firstLine == lastLine ? "[" + firstLine + "]" : "[" + firstLine + "-" + lastLine + "]";
    }
}
