package com.vidnyan.dokita.domain.manifest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed Cargo.toml.
 * A manifest without a package section is a virtual (workspace) manifest.
 * Dependency maps keep declaration order.
 */
public record CargoManifest(
    PackageSection packageSection,
    Map<DependencyKind, Map<String, Dependency>> dependencies
) {

    public static final String FILE_NAME = "Cargo.toml";
    public static final String LOCK_FILE_NAME = "Cargo.lock";

    public CargoManifest {
        var copy = new EnumMap<DependencyKind, Map<String, Dependency>>(DependencyKind.class);
        for (DependencyKind kind : DependencyKind.values()) {
            Map<String, Dependency> declared = dependencies == null ? null : dependencies.get(kind);
            copy.put(kind, declared == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(declared)));
        }
        dependencies = Collections.unmodifiableMap(copy);
    }

    public boolean hasPackage() {
        return packageSection != null;
    }

    public Map<String, Dependency> dependencies(DependencyKind kind) {
        return dependencies.get(kind);
    }

    public static CargoManifest virtualManifest() {
        return new CargoManifest(null, Map.of());
    }
}
