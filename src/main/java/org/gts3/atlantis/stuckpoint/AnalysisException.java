package org.gts3.atlantis.stuckpoint;

/**
 * Base class of the fatal errors that stop a stuck point analysis run.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
