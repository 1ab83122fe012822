package com.vidnyan.dokita.domain.finding;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Report Model - final, ordered output of an analysis run.
 * Contains findings sorted by severity, file and line, with summary statistics.
 */
@Value
@Builder
public class FindingReport {
    Summary summary;
    List<Finding> findings;

    private static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::severity)
            .thenComparing(Finding::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Finding::lineNumber, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Finding::code);

    @Value
    @Builder
    public static class Summary {
        int totalFindings;
        int errorCount;
        int warningCount;
        int noteCount;
    }

    /**
     * Build report from an unordered collection of findings.
     */
    public static FindingReport build(List<Finding> findings) {
        List<Finding> ordered = findings.stream()
                .sorted(ORDER)
                .toList();

        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        ordered.forEach(f -> bySeverity.merge(f.severity(), 1, Integer::sum));

        Summary summary = Summary.builder()
                .totalFindings(ordered.size())
                .errorCount(bySeverity.get(Severity.ERROR))
                .warningCount(bySeverity.get(Severity.WARNING))
                .noteCount(bySeverity.get(Severity.NOTE))
                .build();

        return FindingReport.builder()
                .summary(summary)
                .findings(ordered)
                .build();
    }

    /**
     * Determine if the run should PASS or FAIL.
     * Notes alone never fail a run.
     */
    public AnalysisOutcome getOutcome() {
        return findings.stream().anyMatch(Finding::isBlocking) ? AnalysisOutcome.FAIL : AnalysisOutcome.PASS;
    }

    public enum AnalysisOutcome {
        PASS,
        FAIL
    }
}
