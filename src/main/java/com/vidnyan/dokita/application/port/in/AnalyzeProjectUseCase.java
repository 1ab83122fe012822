package com.vidnyan.dokita.application.port.in;

import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.FindingReport;
import com.vidnyan.dokita.domain.finding.Severity;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: analyze a Cargo project and report findings.
 * This is the main entry point to the application.
 */
public interface AnalyzeProjectUseCase {

    /**
     * Run every check against a project.
     * @param request Analysis request parameters
     * @return filtered, ordered findings with run statistics
     * @throws com.vidnyan.dokita.application.error.ProjectAnalysisException when the
     *         project cannot be analyzed at all
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(Path projectPath) {
        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path);
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        Path projectRoot,
        FindingReport report,
        AnalysisStats stats
    ) {
        public List<Finding> findings() {
            return report.getFindings();
        }

        /**
         * True when any Error or Warning survived filtering.
         */
        public boolean isFailing() {
            return report.getOutcome() == FindingReport.AnalysisOutcome.FAIL;
        }

        public int findingCount(Severity severity) {
            FindingReport.Summary summary = report.getSummary();
            return switch (severity) {
                case ERROR -> summary.getErrorCount();
                case WARNING -> summary.getWarningCount();
                case NOTE -> summary.getNoteCount();
            };
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesScanned,
        int rulesApplied,
        int findingsBeforeFiltering,
        int findingsSuppressed,
        long totalDurationMs
    ) {}
}
