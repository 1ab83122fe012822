package com.vidnyan.dokita.domain.manifest;

/**
 * Role of a dependency table in Cargo.toml.
 */
public enum DependencyKind {
    RUNTIME("runtime", "dependencies"),
    DEV("dev", "dev-dependencies"),
    BUILD("build", "build-dependencies");

    private final String role;
    private final String tableName;

    DependencyKind(String role, String tableName) {
        this.role = role;
        this.tableName = tableName;
    }

    /**
     * Short role name used in messages ("runtime", "dev", "build").
     */
    public String role() {
        return role;
    }

    /**
     * Manifest table holding dependencies of this kind.
     */
    public String tableName() {
        return tableName;
    }
}
