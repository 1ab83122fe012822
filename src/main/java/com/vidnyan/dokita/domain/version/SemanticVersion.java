package com.vidnyan.dokita.domain.version;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version with SemVer 2.0 precedence.
 * Build metadata is kept for display but ignored when comparing.
 */
public record SemanticVersion(
    long major,
    long minor,
    long patch,
    List<String> preRelease,
    String build
) implements Comparable<SemanticVersion> {

    private static final Pattern SEMVER = Pattern.compile(
            "^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
                    + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    public SemanticVersion {
        preRelease = preRelease == null ? List.of() : List.copyOf(preRelease);
    }

    /**
     * Parse a version string; empty when it is not valid SemVer.
     */
    public static Optional<SemanticVersion> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = SEMVER.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SemanticVersion(
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3)),
                    matcher.group(4) == null ? List.of() : Arrays.asList(matcher.group(4).split("\\.")),
                    matcher.group(5)));
        } catch (NumberFormatException e) {
            // segment overflows a long
            return Optional.empty();
        }
    }

    public boolean isPreRelease() {
        return !preRelease.isEmpty();
    }

    public boolean isOlderThan(SemanticVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int cmp = Long.compare(major, other.major);
        if (cmp != 0) return cmp;
        cmp = Long.compare(minor, other.minor);
        if (cmp != 0) return cmp;
        cmp = Long.compare(patch, other.patch);
        if (cmp != 0) return cmp;
        return comparePreRelease(preRelease, other.preRelease);
    }

    private static int comparePreRelease(List<String> left, List<String> right) {
        // A release ranks above any of its pre-releases
        if (left.isEmpty() || right.isEmpty()) {
            return Boolean.compare(left.isEmpty(), right.isEmpty());
        }
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int cmp = compareIdentifier(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareIdentifier(String left, String right) {
        boolean leftNumeric = NUMERIC.matcher(left).matches();
        boolean rightNumeric = NUMERIC.matcher(right).matches();
        if (leftNumeric && rightNumeric) {
            int cmp = Integer.compare(left.length(), right.length());
            return cmp != 0 ? cmp : left.compareTo(right);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    @Override
    public String toString() {
        var text = new StringBuilder()
                .append(major).append('.').append(minor).append('.').append(patch);
        if (isPreRelease()) {
            text.append('-').append(String.join(".", preRelease));
        }
        if (build != null) {
            text.append('+').append(build);
        }
        return text.toString();
    }
}
