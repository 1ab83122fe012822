package com.vidnyan.dokita.adapter.out.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.adapter.out.process.ProcessExecutor;
import com.vidnyan.dokita.application.port.out.DependencyGraphResolver;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.Member;
import com.vidnyan.dokita.domain.graph.ResolvedDependencyGraph.ResolvedDependency;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the dependency graph through {@code cargo metadata}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CargoMetadataResolver implements DependencyGraphResolver {

    static final Set<String> CRATES_IO_SOURCES = Set.of(
            "registry+https://github.com/rust-lang/crates.io-index",
            "sparse+https://index.crates.io/");

    private final ProcessExecutor processExecutor;
    private final ObjectMapper objectMapper;
    private final DokitaProperties properties;

    @Override
    public CheckResult<ResolvedDependencyGraph> resolve(Path manifestPath) {
        List<String> command = new ArrayList<>(properties.getMetadata().getCommand());
        command.add("--manifest-path");
        command.add(manifestPath.toString());

        ProcessExecutor.Outcome outcome = processExecutor.execute(
                command, manifestPath.getParent(), properties.getMetadata().getTimeout());

        if (outcome instanceof ProcessExecutor.FailedToStart failed) {
            return unavailable("could not run '" + command.get(0) + "': "
                    + failed.cause().getMessage());
        }
        if (outcome instanceof ProcessExecutor.TimedOut timedOut) {
            return unavailable("cargo metadata did not finish within " + timedOut.timeout());
        }

        ProcessExecutor.Completed completed = (ProcessExecutor.Completed) outcome;
        if (completed.exitCode() != 0) {
            return unavailable("cargo metadata exited with " + completed.exitCode() + ": "
                    + firstLine(completed.stderr()));
        }

        try {
            ResolvedDependencyGraph graph = parse(objectMapper.readTree(completed.stdout()));
            log.debug("Resolved {} workspace members", graph.members().size());
            return CheckResult.success(graph);
        } catch (IOException e) {
            return unavailable("unreadable cargo metadata output: " + e.getMessage());
        }
    }

    /**
     * Map {@code cargo metadata --format-version 1} output to the direct dependencies of
     * every workspace member.
     */
    static ResolvedDependencyGraph parse(JsonNode metadata) {
        Map<String, JsonNode> packagesById = new HashMap<>();
        for (JsonNode pkg : metadata.path("packages")) {
            packagesById.put(pkg.path("id").asText(), pkg);
        }
        Map<String, JsonNode> nodesById = new HashMap<>();
        for (JsonNode node : metadata.path("resolve").path("nodes")) {
            nodesById.put(node.path("id").asText(), node);
        }

        List<Member> members = new ArrayList<>();
        for (JsonNode memberId : metadata.path("workspace_members")) {
            JsonNode pkg = packagesById.get(memberId.asText());
            if (pkg == null) {
                log.debug("Workspace member {} missing from packages", memberId.asText());
                continue;
            }
            JsonNode node = nodesById.get(memberId.asText());
            members.add(new Member(
                    pkg.path("name").asText(),
                    pkg.path("version").asText(),
                    directDependencies(pkg, node, packagesById)));
        }
        return new ResolvedDependencyGraph(members);
    }

    private static List<ResolvedDependency> directDependencies(JsonNode pkg, JsonNode node,
                                                               Map<String, JsonNode> packagesById) {
        if (node == null) {
            return List.of();
        }
        // resolve.nodes[].deps[].name is the extern crate name: underscored, rename applied
        Map<String, String> resolvedIdByCrateName = new HashMap<>();
        for (JsonNode dep : node.path("deps")) {
            resolvedIdByCrateName.put(dep.path("name").asText(), dep.path("pkg").asText());
        }

        Map<String, ResolvedDependency> direct = new LinkedHashMap<>();
        for (JsonNode declared : pkg.path("dependencies")) {
            String name = declared.path("name").asText();
            if (direct.containsKey(name)) {
                continue;
            }
            String rename = declared.path("rename").isTextual() ? declared.path("rename").asText() : null;
            String crateName = normalize(rename != null ? rename : name);
            String resolvedId = resolvedIdByCrateName.get(crateName);
            JsonNode resolved = resolvedId == null ? null : packagesById.get(resolvedId);
            if (resolved == null) {
                // optional dependency not enabled, or a target the resolver skipped
                continue;
            }
            direct.put(name, new ResolvedDependency(
                    name,
                    resolved.path("version").asText(),
                    isCratesIoSource(resolved.path("source"))));
        }
        return List.copyOf(direct.values());
    }

    /**
     * Only crates.io packages are looked up; alternate and private registries are not.
     */
    static boolean isCratesIoSource(JsonNode source) {
        return source.isTextual() && CRATES_IO_SOURCES.contains(source.asText());
    }

    private static String normalize(String crateName) {
        return crateName.replace('-', '_');
    }

    private static String firstLine(String text) {
        if (text == null || text.isBlank()) {
            return "no error output";
        }
        return text.strip().lines().findFirst().orElse("no error output");
    }

    private static CheckResult<ResolvedDependencyGraph> unavailable(String reason) {
        log.warn("Dependency graph unavailable: {}", reason);
        return CheckResult.degraded(Finding.of(CheckCode.DP003,
                "Could not resolve the dependency graph, skipping freshness checks: " + reason,
                Severity.WARNING, CargoManifest.FILE_NAME));
    }
}
