package com.vidnyan.dokita.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.application.port.out.AuditRunner;
import com.vidnyan.dokita.application.port.out.AuditRunner.AuditOutput;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the audit tool's JSON report into findings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VulnerabilityScanner {

    static final int EXCERPT_LENGTH = 200;

    /**
     * Every code an audit run can report, including the runner's own degradations.
     */
    static final List<CheckCode> EMITTED_CODES = List.of(CheckCode.SEC001, CheckCode.AUD001, CheckCode.AUD002,
            CheckCode.AUD003, CheckCode.AUD004, CheckCode.AUD005);

    private final AuditRunner auditRunner;
    private final ObjectMapper objectMapper;

    public List<Finding> scan(Path projectRoot, CheckRegistry registry) {
        if (EMITTED_CODES.stream().noneMatch(registry::isEnabled)) {
            log.debug("All audit codes disabled; not running the audit");
            return List.of();
        }
        CheckResult<AuditOutput> result = auditRunner.run(projectRoot);
        return result.toFindings(output -> interpret(output, projectRoot.resolve(CargoManifest.LOCK_FILE_NAME).toString()));
    }

    List<Finding> interpret(AuditOutput output, String lockFile) {
        if (!output.succeeded() && output.stdout().isBlank()) {
            return List.of(Finding.of(CheckCode.AUD001,
                    "cargo-audit execution failed: " + firstLine(output.stderr()),
                    Severity.WARNING, lockFile));
        }

        JsonNode vulnerabilities;
        try {
            vulnerabilities = objectMapper.readTree(output.stdout()).path("vulnerabilities").path("list");
            if (!vulnerabilities.isArray()) {
                throw new IllegalStateException("missing vulnerabilities.list");
            }
        } catch (JsonProcessingException | IllegalStateException e) {
            String excerpt = excerpt(output.stdout());
            if (output.succeeded()) {
                log.warn("Ignoring unparseable cargo-audit output: {}. Output: {}", e.getMessage(), excerpt);
                return List.of();
            }
            return List.of(Finding.of(CheckCode.AUD003,
                    "Failed to parse cargo-audit JSON output: " + e.getMessage() + ". Output: " + excerpt,
                    Severity.WARNING, lockFile));
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode entry : vulnerabilities) {
            List<String> patched = new ArrayList<>();
            entry.path("versions").path("patched").forEach(version -> patched.add(version.asText()));
            findings.add(Finding.of(CheckCode.SEC001,
                    "Vulnerability found in '" + entry.path("package").path("name").asText("unknown") + "': "
                            + entry.path("advisory").path("title").asText("untitled advisory")
                            + " (ID: " + entry.path("advisory").path("id").asText("unknown") + "). Patched in: "
                            + (patched.isEmpty() ? "none" : String.join(", ", patched)) + ".",
                    Severity.ERROR, lockFile));
        }

        if (findings.isEmpty() && !output.succeeded()) {
            findings.add(Finding.of(CheckCode.AUD002,
                    "cargo-audit indicated an issue but no vulnerabilities found in JSON: "
                            + firstLine(output.stderr()),
                    Severity.WARNING, lockFile));
        }
        log.debug("Audit reported {} vulnerabilities", findings.size());
        return findings;
    }

    private static String excerpt(String text) {
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }

    private static String firstLine(String text) {
        if (text == null || text.isBlank()) {
            return "Unknown error";
        }
        return text.strip().lines().findFirst().orElse("Unknown error");
    }
}
