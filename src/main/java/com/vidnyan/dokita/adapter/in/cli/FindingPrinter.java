package com.vidnyan.dokita.adapter.in.cli;

import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisResult;

import java.io.PrintStream;

/**
 * Renders the findings of a run to the report stream.
 */
public interface FindingPrinter {

    OutputFormat format();

    void print(AnalysisResult result, PrintStream out);
}
