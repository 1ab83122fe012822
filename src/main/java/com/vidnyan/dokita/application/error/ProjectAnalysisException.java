package com.vidnyan.dokita.application.error;

/**
 * An environment problem that aborts a run before any check executes.
 * Never converted into a finding.
 */
public class ProjectAnalysisException extends RuntimeException {

    public ProjectAnalysisException(String message) {
        super(message);
    }

    public ProjectAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
