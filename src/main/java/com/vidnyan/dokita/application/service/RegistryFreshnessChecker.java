package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.application.port.out.DependencyGraphResolver;
import com.vidnyan.dokita.application.port.out.PackageRegistry;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.Member;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.ResolvedDependency;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import com.vidnyan.dokita.domain.version.SemanticVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares resolved direct dependency versions with the latest registry release.
 * Registry calls are sequential; each package name is looked up at most once per run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistryFreshnessChecker {

    /**
     * Every code this checker can report. Disabling a subset only filters those findings later.
     */
    static final List<CheckCode> EMITTED_CODES = List.of(CheckCode.DP002, CheckCode.DP003, CheckCode.API001);

    private final DependencyGraphResolver graphResolver;
    private final PackageRegistry packageRegistry;

    public List<Finding> check(Path manifestPath, CheckRegistry registry) {
        if (EMITTED_CODES.stream().noneMatch(registry::isEnabled)) {
            log.debug("All dependency freshness codes disabled; skipping registry lookups");
            return List.of();
        }

        CheckResult<ResolvedDependencyGraph> graph = graphResolver.resolve(manifestPath);
        if (graph instanceof CheckResult.Degraded<ResolvedDependencyGraph> degraded) {
            return List.of(degraded.finding());
        }
        return compare(((CheckResult.Success<ResolvedDependencyGraph>) graph).value());
    }

    List<Finding> compare(ResolvedDependencyGraph graph) {
        List<Finding> findings = new ArrayList<>();
        Map<String, CheckResult<String>> lookups = new HashMap<>();

        for (Member member : graph.members()) {
            for (ResolvedDependency dependency : member.directDependencies()) {
                if (!dependency.registrySourced()) {
                    continue;
                }
                boolean firstLookup = !lookups.containsKey(dependency.name());
                CheckResult<String> latest = lookups.computeIfAbsent(
                        dependency.name(), packageRegistry::latestStableVersion);

                if (latest instanceof CheckResult.Degraded<String> degraded) {
                    if (firstLookup) {
                        findings.add(degraded.finding());
                    }
                    continue;
                }
                String latestVersion = ((CheckResult.Success<String>) latest).value();
                outdated(dependency, latestVersion).ifPresent(findings::add);
            }
        }
        log.debug("Checked {} registry packages", lookups.size());
        return findings;
    }

    private Optional<Finding> outdated(ResolvedDependency dependency, String latestVersion) {
        Optional<SemanticVersion> current = SemanticVersion.parse(dependency.resolvedVersion());
        Optional<SemanticVersion> latest = SemanticVersion.parse(latestVersion);
        if (current.isEmpty() || latest.isEmpty()) {
            log.warn("Could not parse versions for {}: current '{}', latest '{}'",
                    dependency.name(), dependency.resolvedVersion(), latestVersion);
            return Optional.empty();
        }
        if (!current.get().isOlderThan(latest.get())) {
            return Optional.empty();
        }
        return Optional.of(Finding.of(CheckCode.DP002,
                "Direct dependency '" + dependency.name() + "' is outdated. Current: "
                        + current.get() + ", Latest: " + latest.get(),
                Severity.NOTE, CargoManifest.FILE_NAME));
    }
}
