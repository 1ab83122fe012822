package com.vidnyan.dokita.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Pretty-printed JSON array of findings; {@code []} when there are none.
 */
@Component
@RequiredArgsConstructor
public class JsonFindingPrinter implements FindingPrinter {

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public void print(AnalysisResult result, PrintStream out) {
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result.findings()));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Error serializing findings to JSON", e);
        }
    }
}
