package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.application.port.out.LineRuleRepository;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.rule.FileContext;
import com.vidnyan.dokita.domain.rule.FileContextClassifier;
import com.vidnyan.dokita.domain.rule.LineRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Applies the line rules to every collected source file.
 * Files are scanned in parallel on the scan pool; each file is read and scanned by one task.
 */
@Slf4j
@Service
public class PatternScanner {

    private final LineRuleRepository ruleRepository;
    private final ExecutorService scanExecutor;

    public PatternScanner(LineRuleRepository ruleRepository,
                          @Qualifier("scanExecutor") ExecutorService scanExecutor) {
        this.ruleRepository = ruleRepository;
        this.scanExecutor = scanExecutor;
    }

    public List<Finding> scan(List<Path> files, Path projectRoot) {
        List<LineRule> rules = ruleRepository.findAll();
        log.debug("Scanning {} files with {} rules", files.size(), rules.size());

        List<CompletableFuture<List<Finding>>> tasks = files.stream()
                .map(file -> CompletableFuture.supplyAsync(() -> scanFile(file, projectRoot, rules), scanExecutor))
                .toList();

        List<Finding> findings = new ArrayList<>();
        tasks.forEach(task -> findings.addAll(task.join()));
        return findings;
    }

    public int ruleCount() {
        return ruleRepository.findAll().size();
    }

    /**
     * Findings for one file, in ascending line order.
     */
    List<Finding> scanFile(Path file, Path projectRoot, List<LineRule> rules) {
        String displayPath = displayPath(projectRoot, file);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", file, e.toString());
            return List.of(Finding.of(CheckCode.IO001,
                    "Failed to read file: " + e.getMessage(), Severity.WARNING, displayPath));
        }

        FileContext context = FileContextClassifier.classify(projectRoot, file);
        List<LineRule> applicable = rules.stream()
                .filter(rule -> rule.appliesTo(context))
                .toList();
        if (applicable.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        int lineNumber = 0;
        for (String line : content.lines().toList()) {
            lineNumber++;
            for (LineRule rule : applicable) {
                rule.evaluate(line, lineNumber, displayPath).ifPresent(findings::add);
            }
        }
        return findings;
    }

    /**
     * Project-relative path with forward slashes.
     */
    static String displayPath(Path projectRoot, Path file) {
        return FileContextClassifier.relativize(projectRoot, file).toString().replace('\\', '/');
    }
}
