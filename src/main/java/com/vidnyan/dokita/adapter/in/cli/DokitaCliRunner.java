package com.vidnyan.dokita.adapter.in.cli;

import com.vidnyan.dokita.application.error.ProjectAnalysisException;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisRequest;
import com.vidnyan.dokita.application.port.in.AnalyzeProjectUseCase.AnalysisResult;
import com.vidnyan.dokita.domain.finding.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * CLI runner: analyzes one project and prints the report to stdout.
 * Exit code 0 when nothing blocking was found, 1 when an Error or Warning was, 2 when the
 * project could not be analyzed or the arguments were invalid.
 */
@Slf4j
@Component
public class DokitaCliRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_FINDINGS = 1;
    public static final int EXIT_ENVIRONMENT_ERROR = 2;

    private final AnalyzeProjectUseCase analyzeProjectUseCase;
    private final Map<OutputFormat, FindingPrinter> printers = new EnumMap<>(OutputFormat.class);
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_CLEAN;

    @Autowired
    public DokitaCliRunner(AnalyzeProjectUseCase analyzeProjectUseCase, List<FindingPrinter> printers) {
        this(analyzeProjectUseCase, printers, System.out, System.err);
    }

    DokitaCliRunner(AnalyzeProjectUseCase analyzeProjectUseCase, List<FindingPrinter> printers,
                    PrintStream out, PrintStream err) {
        this.analyzeProjectUseCase = analyzeProjectUseCase;
        printers.forEach(printer -> this.printers.put(printer.format(), printer));
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            exitCode = EXIT_ENVIRONMENT_ERROR;
            return;
        }
        if (arguments.format() == OutputFormat.HUMAN && !"human".equalsIgnoreCase(arguments.rawFormat())) {
            log.warn("Unknown format '{}', using human output", arguments.rawFormat());
        }

        log.info("Analyzing {}", arguments.projectPath());
        AnalysisResult result;
        try {
            result = analyzeProjectUseCase.analyze(AnalysisRequest.forPath(arguments.projectPath()));
        } catch (ProjectAnalysisException e) {
            log.error("Analysis aborted: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            exitCode = EXIT_ENVIRONMENT_ERROR;
            return;
        }

        printers.get(arguments.format()).print(result, out);
        out.flush();

        log.info("Files scanned: {}, rules: {}, errors: {}, warnings: {}, notes: {}, duration: {}ms",
                result.stats().filesScanned(),
                result.stats().rulesApplied(),
                result.findingCount(Severity.ERROR),
                result.findingCount(Severity.WARNING),
                result.findingCount(Severity.NOTE),
                result.stats().totalDurationMs());
        exitCode = result.isFailing() ? EXIT_FINDINGS : EXIT_CLEAN;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
