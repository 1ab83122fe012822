package com.vidnyan.dokita.domain.finding;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Finding severity levels, most severe first.
 */
public enum Severity {
    ERROR("Error"),      // Must fix - fails CI
    WARNING("Warning"),  // Should fix - fails CI
    NOTE("Note");        // Informational only

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /**
     * Whether a finding of this severity fails the run.
     */
    public boolean isBlocking() {
        return this != NOTE;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
