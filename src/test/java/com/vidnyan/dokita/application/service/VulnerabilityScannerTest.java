package com.vidnyan.dokita.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.application.port.out.AuditRunner;
import com.vidnyan.dokita.application.port.out.AuditRunner.AuditOutput;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VulnerabilityScannerTest {

    private final Path root = Path.of("/work/app");
    private final String lockFile = root.resolve("Cargo.lock").toString();

    private List<Finding> scan(int exitCode, String stdout, String stderr) {
        AuditRunner runner = projectRoot -> CheckResult.success(new AuditOutput(exitCode, stdout, stderr));
        return new VulnerabilityScanner(runner, new ObjectMapper()).scan(root, CheckRegistry.defaults());
    }

    @Test
    void scan_ShouldReportEachVulnerability() {
        List<Finding> findings = scan(1, """
                {"database": {}, "lockfile": {"dependency-count": 42},
                 "vulnerabilities": {"found": true, "count": 2, "list": [
                   {"advisory": {"id": "RUSTSEC-2020-0071", "title": "Potential segfault in time"},
                    "package": {"name": "time", "version": "0.1.43"},
                    "versions": {"patched": [">=0.2.23"], "unaffected": []}},
                   {"advisory": {"id": "RUSTSEC-2021-0139", "title": "ansi_term is unmaintained"},
                    "package": {"name": "ansi_term"},
                    "versions": {"patched": []}}
                 ]}}
                """, "");

        assertEquals(2, findings.size());
        assertTrue(findings.stream().allMatch(f -> f.code().equals("SEC001")));
        assertTrue(findings.stream().allMatch(f -> f.severity() == Severity.ERROR));
        assertTrue(findings.stream().allMatch(f -> lockFile.equals(f.filePath())));
        assertEquals("Vulnerability found in 'time': Potential segfault in time (ID: RUSTSEC-2020-0071). "
                + "Patched in: >=0.2.23.", findings.get(0).message());
    }

    @Test
    void scan_ShouldReportNothingForCleanAudit() {
        assertTrue(scan(0, "{\"vulnerabilities\": {\"found\": false, \"count\": 0, \"list\": []}}", "").isEmpty());
    }

    @Test
    void scan_ShouldReportToolFailureWithFirstStderrLine() {
        List<Finding> findings = scan(2, "", "error: couldn't load Cargo.lock\ncaused by: missing file\n");

        assertEquals(1, findings.size());
        assertEquals("AUD001", findings.get(0).code());
        assertEquals("cargo-audit execution failed: error: couldn't load Cargo.lock", findings.get(0).message());
    }

    @Test
    void scan_ShouldReportAmbiguousFailure() {
        List<Finding> findings = scan(1, "{\"vulnerabilities\": {\"list\": []}}", "warning: yanked crate");

        assertEquals(List.of("AUD002"), findings.stream().map(Finding::code).toList());
    }

    @Test
    void scan_ShouldReportUnparseableOutputOnFailure() {
        String garbage = "x".repeat(500);

        List<Finding> findings = scan(1, garbage, "");

        assertEquals(List.of("AUD003"), findings.stream().map(Finding::code).toList());
        assertTrue(findings.get(0).message().endsWith("Output: " + "x".repeat(VulnerabilityScanner.EXCERPT_LENGTH)));
    }

    @Test
    void scan_ShouldIgnoreUnparseableOutputOnSuccess() {
        assertTrue(scan(0, "not json", "").isEmpty());
    }

    @Test
    void scan_ShouldPassDegradedRunThrough() {
        Finding missingTool = Finding.of("AUD004", "Failed to execute 'cargo audit'.", Severity.WARNING, null);
        VulnerabilityScanner scanner = new VulnerabilityScanner(
                projectRoot -> CheckResult.degraded(missingTool), new ObjectMapper());

        assertEquals(List.of(missingTool), scanner.scan(root, CheckRegistry.defaults()));
    }

    @Test
    void scan_ShouldStillReportMissingToolWhenVulnerabilityCodeDisabled() {
        Finding missingTool = Finding.of("AUD004", "Failed to execute 'cargo audit'.", Severity.WARNING, null);
        VulnerabilityScanner scanner = new VulnerabilityScanner(
                projectRoot -> CheckResult.degraded(missingTool), new ObjectMapper());

        assertEquals(List.of(missingTool), scanner.scan(root, CheckRegistry.defaults().with("SEC001", false)));
    }

    @Test
    void scan_ShouldNotRunAuditWhenEveryCodeDisabled() {
        VulnerabilityScanner scanner = new VulnerabilityScanner(
                projectRoot -> fail("audit must not run"), new ObjectMapper());
        CheckRegistry allOff = CheckRegistry.defaults();
        for (var code : VulnerabilityScanner.EMITTED_CODES) {
            allOff = allOff.with(code.code(), false);
        }

        assertTrue(scanner.scan(root, allOff).isEmpty());
    }
}
