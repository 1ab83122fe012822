package com.vidnyan.dokita.domain.manifest;

/**
 * The package readme field. Cargo accepts a path string or {@code false}.
 */
public record ReadmeField(Kind kind, String path, String rawValue) {

    public enum Kind {
        ABSENT,
        PATH,
        DISABLED,
        MALFORMED
    }

    private static final ReadmeField ABSENT = new ReadmeField(Kind.ABSENT, null, null);
    private static final ReadmeField DISABLED = new ReadmeField(Kind.DISABLED, null, "false");

    public static ReadmeField absent() {
        return ABSENT;
    }

    public static ReadmeField disabled() {
        return DISABLED;
    }

    public static ReadmeField path(String path) {
        return new ReadmeField(Kind.PATH, path, path);
    }

    public static ReadmeField malformed(String rawValue) {
        return new ReadmeField(Kind.MALFORMED, null, rawValue);
    }
}
