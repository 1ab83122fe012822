package com.vidnyan.dokita.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisStats;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.FindingReport;
import com.vidnyan.dokita.domain.finding.Severity;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFindingPrinterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonFindingPrinter printer = new JsonFindingPrinter(objectMapper);

    private String render(List<Finding> findings) {
        AnalysisResult result = new AnalysisResult(Path.of("/crate"), FindingReport.build(findings),
                new AnalysisStats(0, 4, findings.size(), 0, 1));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        printer.print(result, new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void print_ShouldWriteEmptyArrayWhenClean() throws Exception {
        JsonNode json = objectMapper.readTree(render(List.of()));

        assertTrue(json.isArray());
        assertEquals(0, json.size());
    }

    @Test
    void print_ShouldUseSnakeCaseFieldsAndSeverityLabels() throws Exception {
        // Arrange
        List<Finding> findings = List.of(
                Finding.of("CODE001", "'.unwrap()' used in library context.", Severity.WARNING, "src/lib.rs")
                        .withLine(7),
                Finding.of("API001", "Failed to fetch", Severity.WARNING, null));

        // Act
        JsonNode json = objectMapper.readTree(render(findings));

        // Assert
        assertEquals(2, json.size());
        JsonNode unwrap = json.get(1);
        assertEquals("CODE001", unwrap.get("code").asText());
        assertEquals("Warning", unwrap.get("severity").asText());
        assertEquals("src/lib.rs", unwrap.get("file_path").asText());
        assertEquals(7, unwrap.get("line_number").asInt());
        assertFalse(unwrap.has("blocking"));

        JsonNode api = json.get(0);
        assertTrue(api.get("file_path").isNull());
        assertTrue(api.get("line_number").isNull());
    }
}
