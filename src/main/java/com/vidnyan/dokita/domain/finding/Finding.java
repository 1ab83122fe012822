package com.vidnyan.dokita.domain.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single reported issue.
 * Immutable value object; the only way to change one is {@link #withLine(int)}, which returns a copy.
 */
@JsonPropertyOrder({"code", "message", "severity", "file_path", "line_number"})
public record Finding(
    String code,
    String message,
    Severity severity,
    @JsonProperty("file_path") String filePath,
    @JsonProperty("line_number") Integer lineNumber
) {

    public Finding {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
    }

    public static Finding of(String code, String message, Severity severity, String filePath) {
        return new Finding(code, message, severity, filePath, null);
    }

    public static Finding of(CheckCode code, String message, Severity severity, String filePath) {
        return of(code.code(), message, severity, filePath);
    }

    /**
     * Copy of this finding pointing at a 1-based line.
     */
    public Finding withLine(int line) {
        return new Finding(code, message, severity, filePath, line);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return severity.isBlocking();
    }

    /**
     * Format location as "file:line", "file" or "N/A".
     */
    public String formatLocation() {
        if (filePath == null) {
            return "N/A";
        }
        return lineNumber == null ? filePath : filePath + ":" + lineNumber;
    }
}
