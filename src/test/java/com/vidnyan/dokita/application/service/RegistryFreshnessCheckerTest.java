package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.application.port.out.PackageRegistry;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.Member;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.ResolvedDependency;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegistryFreshnessCheckerTest {

    private final Path manifestPath = Path.of("/work/app/Cargo.toml");
    private final List<String> lookups = new ArrayList<>();

    private PackageRegistry registryWith(Map<String, String> latest) {
        return name -> {
            lookups.add(name);
            String version = latest.get(name);
            return version != null
                    ? CheckResult.success(version)
                    : CheckResult.degraded(Finding.of("API001",
                            "Failed to fetch latest version for dependency '" + name + "': 404",
                            Severity.WARNING, null));
        };
    }

    private static ResolvedDependencyGraph graph(Member... members) {
        return new ResolvedDependencyGraph(List.of(members));
    }

    private static Member member(String name, ResolvedDependency... deps) {
        return new Member(name, "0.1.0", List.of(deps));
    }

    private static ResolvedDependency dep(String name, String version) {
        return new ResolvedDependency(name, version, true);
    }

    private List<Finding> check(ResolvedDependencyGraph graph, PackageRegistry registry) {
        RegistryFreshnessChecker checker = new RegistryFreshnessChecker(path -> CheckResult.success(graph), registry);
        return checker.check(manifestPath, CheckRegistry.defaults());
    }

    @Test
    void check_ShouldReportOutdatedDependency() {
        List<Finding> findings = check(graph(member("app", dep("foo", "1.0.0"))),
                registryWith(Map.of("foo", "1.2.3")));

        assertEquals(1, findings.size());
        assertEquals("DP002", findings.get(0).code());
        assertEquals(Severity.NOTE, findings.get(0).severity());
        assertEquals("Direct dependency 'foo' is outdated. Current: 1.0.0, Latest: 1.2.3", findings.get(0).message());
    }

    @Test
    void check_ShouldStayQuietWhenUpToDateOrAhead() {
        List<Finding> findings = check(
                graph(member("app", dep("foo", "1.2.3"), dep("bar", "2.0.0-beta.1"))),
                registryWith(Map.of("foo", "1.2.3", "bar", "1.9.0")));

        assertTrue(findings.isEmpty());
    }

    @Test
    void check_ShouldDegradeLookupFailureAndContinue() {
        List<Finding> findings = check(
                graph(member("app", dep("missing", "1.0.0"), dep("foo", "0.9.0"))),
                registryWith(Map.of("foo", "1.0.0")));

        assertEquals(List.of("API001", "DP002"), findings.stream().map(Finding::code).toList());
    }

    @Test
    void check_ShouldSkipNonRegistryDependencies() {
        List<Finding> findings = check(
                graph(member("app", new ResolvedDependency("local", "0.1.0", false))),
                registryWith(Map.of()));

        assertTrue(findings.isEmpty());
        assertTrue(lookups.isEmpty());
    }

    @Test
    void check_ShouldLookUpEachPackageOnce() {
        List<Finding> findings = check(
                graph(member("core", dep("serde", "1.0.0"), dep("gone", "1.0.0")),
                        member("cli", dep("serde", "1.0.0"), dep("gone", "1.0.0"))),
                registryWith(Map.of("serde", "1.0.1")));

        assertEquals(List.of("serde", "gone"), lookups);
        assertEquals(List.of("DP002", "API001", "DP002"), findings.stream().map(Finding::code).toList());
    }

    @Test
    void check_ShouldSkipUnparseableVersions() {
        List<Finding> findings = check(graph(member("app", dep("odd", "1.0"))),
                registryWith(Map.of("odd", "2.0.0")));

        assertTrue(findings.isEmpty());
    }

    @Test
    void check_ShouldReportUnavailableGraphOnce() {
        Finding unavailable = Finding.of("DP003", "Could not resolve the dependency graph", Severity.WARNING,
                "Cargo.toml");
        RegistryFreshnessChecker checker = new RegistryFreshnessChecker(
                path -> CheckResult.degraded(unavailable), registryWith(Map.of()));

        assertEquals(List.of(unavailable), checker.check(manifestPath, CheckRegistry.defaults()));
        assertTrue(lookups.isEmpty());
    }

    @Test
    void check_ShouldStillLookUpWhenOnlyOutdatedCodeDisabled() {
        RegistryFreshnessChecker checker = new RegistryFreshnessChecker(
                path -> CheckResult.success(graph(member("app", dep("foo", "1.0.0"), dep("gone", "1.0.0")))),
                registryWith(Map.of("foo", "2.0.0")));

        List<Finding> findings = checker.check(manifestPath, CheckRegistry.defaults().with("DP002", false));

        assertEquals(List.of("foo", "gone"), lookups);
        assertTrue(findings.stream().anyMatch(f -> f.code().equals("API001")));
    }

    @Test
    void check_ShouldSkipLookupsWhenEveryCodeDisabled() {
        RegistryFreshnessChecker checker = new RegistryFreshnessChecker(
                path -> fail("graph must not be resolved"),
                registryWith(Map.of("foo", "2.0.0")));
        CheckRegistry allOff = CheckRegistry.defaults()
                .with("DP002", false)
                .with("DP003", false)
                .with("API001", false);

        assertTrue(checker.check(manifestPath, allOff).isEmpty());
        assertTrue(lookups.isEmpty());
    }
}
