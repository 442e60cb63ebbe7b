package org.gts3.atlantis.stuckpoint.utils;

/**
 * Prefixes for warning and error lines, so the fuzzing pipeline that runs the analyzer can grep them.
 */
public enum LogLabel {
    LOG_WARN("CRS-JAVA-WARN-stuck-point "),
    LOG_ERROR("CRS-JAVA-ERR-stuck-point ");

    private final String label;

    LogLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
