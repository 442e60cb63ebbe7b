package org.gts3.atlantis.stuckpoint.program;

import org.gts3.atlantis.stuckpoint.AnalysisException;

/**
 * Thrown when the program under analysis cannot be loaded at all.
 */
public class ProgramLoadException extends AnalysisException {

    public ProgramLoadException(String message) {
        super(message);
    }

    public ProgramLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
