package com.vidnyan.dokita.domain.manifest;

import java.util.List;

/**
 * A declared dependency: either a bare version requirement or a detailed table.
 */
public sealed interface Dependency permits Dependency.Simple, Dependency.Detailed {

    String WILDCARD = "*";

    /**
     * Declared version requirement, or null when the table has none.
     */
    String versionRequirement();

    /**
     * A path dependency without a version never comes from the registry.
     */
    boolean isLocal();

    default boolean isWildcard() {
        return WILDCARD.equals(versionRequirement()) && !isLocal();
    }

    /**
     * {@code serde = "1.0"}
     */
    record Simple(String versionRequirement) implements Dependency {
        @Override
        public boolean isLocal() {
            return false;
        }
    }

    /**
     * {@code serde = { version = "1.0", features = ["derive"] }}
     */
    record Detailed(
        String version,
        String path,
        List<String> features,
        boolean workspace
    ) implements Dependency {

        public Detailed {
            features = features == null ? List.of() : List.copyOf(features);
        }

        @Override
        public String versionRequirement() {
            return version;
        }

        @Override
        public boolean isLocal() {
            return path != null && version == null;
        }
    }
}
