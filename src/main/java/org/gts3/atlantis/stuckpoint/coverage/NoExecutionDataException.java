package org.gts3.atlantis.stuckpoint.coverage;

import java.nio.file.Path;

import org.gts3.atlantis.stuckpoint.AnalysisException;

/**
 * Thrown when the JaCoCo execution data file is missing or cannot be read.
 */
public class NoExecutionDataException extends AnalysisException {
    private final Path execFile;

    public NoExecutionDataException(Path execFile, String message, Throwable cause) {
        super("Cannot load execution data from " + execFile + ": " + message, cause);
        this.execFile = execFile;
    }

    public Path getExecFile() {
        return execFile;
    }
}
