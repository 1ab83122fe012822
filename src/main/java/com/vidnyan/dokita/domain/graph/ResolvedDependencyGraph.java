package com.vidnyan.dokita.domain.graph;

import java.util.List;

/**
 * Resolved dependency graph of a workspace: each member with the concrete versions
 * selected for its direct dependencies.
 */
public record ResolvedDependencyGraph(List<Member> members) {

    public ResolvedDependencyGraph {
        members = List.copyOf(members);
    }

    /**
     * A workspace member package.
     */
    public record Member(String name, String version, List<ResolvedDependency> directDependencies) {
        public Member {
            directDependencies = List.copyOf(directDependencies);
        }
    }

    /**
     * A direct dependency with the version the resolver actually picked.
     * {@code registrySourced} is true only for crates.io packages; path, git and
     * alternate-registry dependencies are false.
     */
    public record ResolvedDependency(String name, String resolvedVersion, boolean registrySourced) {
    }
}
