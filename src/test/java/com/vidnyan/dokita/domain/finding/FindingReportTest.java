package com.vidnyan.dokita.domain.finding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FindingReportTest {

    @Test
    void build_ShouldOrderBySeverityThenFileThenLine() {
        Finding note = Finding.of("CODE004", "todo", Severity.NOTE, "src/a.rs").withLine(3);
        Finding laterWarning = Finding.of("CODE001", "unwrap", Severity.WARNING, "src/b.rs").withLine(9);
        Finding earlierWarning = Finding.of("CODE001", "unwrap", Severity.WARNING, "src/b.rs").withLine(2);
        Finding manifestWarning = Finding.of("MD001", "description", Severity.WARNING, "Cargo.toml");
        Finding error = Finding.of("MD005", "package", Severity.ERROR, "Cargo.toml");
        Finding noFile = Finding.of("API001", "lookup", Severity.WARNING, null);

        FindingReport report = FindingReport.build(
                List.of(note, laterWarning, earlierWarning, manifestWarning, error, noFile));

        assertEquals(List.of(error, noFile, manifestWarning, earlierWarning, laterWarning, note),
                report.getFindings());
        assertEquals(6, report.getSummary().getTotalFindings());
        assertEquals(1, report.getSummary().getErrorCount());
        assertEquals(4, report.getSummary().getWarningCount());
        assertEquals(1, report.getSummary().getNoteCount());
    }

    @Test
    void outcome_ShouldPassWhenOnlyNotesRemain() {
        FindingReport report = FindingReport.build(List.of(
                Finding.of("MD003", "repository", Severity.NOTE, "Cargo.toml")));

        assertEquals(FindingReport.AnalysisOutcome.PASS, report.getOutcome());
    }

    @Test
    void outcome_ShouldFailOnWarning() {
        FindingReport report = FindingReport.build(List.of(
                Finding.of("DP001", "wildcard", Severity.WARNING, "Cargo.toml")));

        assertEquals(FindingReport.AnalysisOutcome.FAIL, report.getOutcome());
    }

    @Test
    void outcome_ShouldFailOnError() {
        FindingReport report = FindingReport.build(List.of(
                Finding.of("MD005", "package", Severity.ERROR, "Cargo.toml"),
                Finding.of("ED001", "edition", Severity.NOTE, "Cargo.toml")));

        assertEquals(FindingReport.AnalysisOutcome.FAIL, report.getOutcome());
    }

    @Test
    void emptyReportPasses() {
        FindingReport report = FindingReport.build(List.of());

        assertTrue(report.getFindings().isEmpty());
        assertEquals(FindingReport.AnalysisOutcome.PASS, report.getOutcome());
    }

    @Test
    void formatLocation_ShouldDescribeFileAndLine() {
        assertEquals("src/a.rs:4", Finding.of("X", "m", Severity.NOTE, "src/a.rs").withLine(4).formatLocation());
        assertEquals("Cargo.toml", Finding.of("X", "m", Severity.NOTE, "Cargo.toml").formatLocation());
        assertEquals("N/A", Finding.of("X", "m", Severity.NOTE, null).formatLocation());
    }
}
