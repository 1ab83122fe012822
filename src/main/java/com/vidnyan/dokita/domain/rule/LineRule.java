package com.vidnyan.dokita.domain.rule;

import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A line-level rule: a pattern plus the finding it produces.
 * Immutable value object loaded from JSON.
 *
 * The message template may contain {@code {1}}, replaced with the first capture group
 * of the match (e.g. which marker a comment used).
 */
public record LineRule(
    String code,
    String name,
    Severity severity,
    Pattern pattern,
    Scope scope,
    String messageTemplate
) {

    public enum Scope {
        /** Only library-context files. */
        LIBRARY,
        /** Every scanned file. */
        ALL
    }

    public boolean appliesTo(FileContext context) {
        return scope == Scope.ALL || context == FileContext.LIBRARY;
    }

    /**
     * Test one line; returns the finding when the pattern occurs in it.
     */
    public Optional<Finding> evaluate(String line, int lineNumber, String filePath) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String captured = matcher.groupCount() >= 1 && matcher.group(1) != null
                ? matcher.group(1)
                : matcher.group();
        String message = messageTemplate.replace("{1}", captured);
        return Optional.of(Finding.of(code, message, severity, filePath).withLine(lineNumber));
    }
}
