package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.application.error.NotCargoProjectException;
import com.vidnyan.dokita.application.error.UnresolvableProjectPathException;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.dokita.application.port.out.CheckConfigLoader;
import com.vidnyan.dokita.application.port.out.ManifestReader;
import com.vidnyan.dokita.application.port.out.SourceFileCollector;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.FindingReport;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Main application service that orchestrates an analysis run.
 * Implements the primary use case.
 *
 * <p>The source scan runs on the calling thread (fanning out to the scan pool) while the two
 * check branches run on the check pool: manifest, layout and lint checks on one side,
 * registry freshness and the security audit on the other. Each branch builds its own list;
 * lists are merged only after every branch has joined.
 */
@Slf4j
@Service
public class AnalysisPipeline implements AnalyzeProjectUseCase {

    enum PipelineStage {
        INIT,
        COLLECTING,
        SCANNING_AND_VALIDATING,
        MERGING,
        FILTERING,
        REPORTED
    }

    private final SourceFileCollector fileCollector;
    private final ManifestReader manifestReader;
    private final CheckConfigLoader configLoader;
    private final PatternScanner patternScanner;
    private final ManifestValidator manifestValidator;
    private final ProjectStructureChecker structureChecker;
    private final RegistryFreshnessChecker freshnessChecker;
    private final VulnerabilityScanner vulnerabilityScanner;
    private final ExecutorService checkExecutor;

    public AnalysisPipeline(SourceFileCollector fileCollector,
                            ManifestReader manifestReader,
                            CheckConfigLoader configLoader,
                            PatternScanner patternScanner,
                            ManifestValidator manifestValidator,
                            ProjectStructureChecker structureChecker,
                            RegistryFreshnessChecker freshnessChecker,
                            VulnerabilityScanner vulnerabilityScanner,
                            @Qualifier("checkExecutor") ExecutorService checkExecutor) {
        this.fileCollector = fileCollector;
        this.manifestReader = manifestReader;
        this.configLoader = configLoader;
        this.patternScanner = patternScanner;
        this.manifestValidator = manifestValidator;
        this.structureChecker = structureChecker;
        this.freshnessChecker = freshnessChecker;
        this.vulnerabilityScanner = vulnerabilityScanner;
        this.checkExecutor = checkExecutor;
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        advance(PipelineStage.INIT, request.projectPath());

        // Environment checks: failures here abort the run
        Path projectRoot = canonicalize(request.projectPath());
        Path manifestPath = projectRoot.resolve(CargoManifest.FILE_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            throw new NotCargoProjectException(projectRoot);
        }
        CargoManifest manifest = manifestReader.read(manifestPath);

        List<Finding> configFindings = new ArrayList<>();
        CheckResult<CheckRegistry> config = configLoader.load(projectRoot);
        CheckRegistry registry;
        if (config instanceof CheckResult.Success<CheckRegistry> success) {
            registry = success.value();
        } else {
            configFindings.add(((CheckResult.Degraded<CheckRegistry>) config).finding());
            registry = CheckRegistry.defaults();
        }

        advance(PipelineStage.COLLECTING, projectRoot);
        List<Path> files = fileCollector.collect(projectRoot);
        log.info("Collected {} source files", files.size());

        advance(PipelineStage.SCANNING_AND_VALIDATING, projectRoot);
        CompletableFuture<List<Finding>> manifestBranch = CompletableFuture.supplyAsync(() -> {
            List<Finding> branch = new ArrayList<>(manifestValidator.validate(manifest, registry));
            branch.addAll(structureChecker.check(projectRoot, manifest, registry));
            return branch;
        }, checkExecutor);
        CompletableFuture<List<Finding>> dependencyBranch = CompletableFuture.supplyAsync(() -> {
            List<Finding> branch = new ArrayList<>(freshnessChecker.check(manifestPath, registry));
            branch.addAll(vulnerabilityScanner.scan(projectRoot, registry));
            return branch;
        }, checkExecutor);
        List<Finding> patternFindings = patternScanner.scan(files, projectRoot);

        advance(PipelineStage.MERGING, projectRoot);
        List<Finding> merged = new ArrayList<>(configFindings);
        merged.addAll(patternFindings);
        merged.addAll(join(manifestBranch));
        merged.addAll(join(dependencyBranch));

        advance(PipelineStage.FILTERING, projectRoot);
        List<Finding> kept = registry.filter(merged);
        FindingReport report = FindingReport.build(kept);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                files.size(),
                patternScanner.ruleCount(),
                merged.size(),
                merged.size() - kept.size(),
                totalDuration.toMillis());

        advance(PipelineStage.REPORTED, projectRoot);
        log.info("Analysis complete: {} findings ({} suppressed) in {}ms",
                kept.size(), stats.findingsSuppressed(), stats.totalDurationMs());
        return new AnalysisResult(projectRoot, report, stats);
    }

    private static Path canonicalize(Path projectPath) {
        try {
            return projectPath.toRealPath();
        } catch (IOException e) {
            throw new UnresolvableProjectPathException(projectPath, e);
        }
    }

    /**
     * Wait for a branch; an unexpected failure inside it propagates unwrapped.
     */
    private static List<Finding> join(CompletableFuture<List<Finding>> branch) {
        try {
            return branch.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static void advance(PipelineStage stage, Path project) {
        log.debug("[{}] {}", stage, project);
    }
}
