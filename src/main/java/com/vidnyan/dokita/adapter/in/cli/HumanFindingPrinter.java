package com.vidnyan.dokita.adapter.in.cli;

import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import com.vidnyan.dokita.domain.finding.Finding;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Locale;

/**
 * One line per finding, then a count.
 */
@Component
public class HumanFindingPrinter implements FindingPrinter {

    static final String HEALTHY = "No issues found. Your project looks healthy (based on current checks)!";

    @Override
    public OutputFormat format() {
        return OutputFormat.HUMAN;
    }

    @Override
    public void print(AnalysisResult result, PrintStream out) {
        if (result.findings().isEmpty()) {
            out.println(HEALTHY);
            return;
        }
        for (Finding finding : result.findings()) {
            out.println(formatLine(finding));
        }
        out.println();
        out.println("Found " + result.findings().size() + " issues.");
    }

    /**
     * {@code [WARNING] (MD001): message [Cargo.toml]}
     */
    static String formatLine(Finding finding) {
        return "[" + finding.severity().name().toUpperCase(Locale.ROOT) + "] (" + finding.code() + "): "
                + finding.message() + " [" + finding.formatLocation() + "]";
    }
}
