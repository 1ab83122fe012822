package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph;

import java.nio.file.Path;

/**
 * Port for resolving the concrete dependency graph of a project.
 */
public interface DependencyGraphResolver {

    CheckResult<ResolvedDependencyGraph> resolve(Path manifestPath);
}
