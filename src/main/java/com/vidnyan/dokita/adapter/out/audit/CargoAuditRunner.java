package com.vidnyan.dokita.adapter.out.audit;

import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.adapter.out.process.ProcessExecutor;
import com.vidnyan.dokita.application.port.out.AuditRunner;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs {@code cargo audit} in the project root.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CargoAuditRunner implements AuditRunner {

    private final ProcessExecutor processExecutor;
    private final DokitaProperties properties;

    @Override
    public CheckResult<AuditOutput> run(Path projectRoot) {
        List<String> command = properties.getAudit().getCommand();
        ProcessExecutor.Outcome outcome = processExecutor.execute(
                command, projectRoot, properties.getAudit().getTimeout());

        if (outcome instanceof ProcessExecutor.FailedToStart failed) {
            log.warn("cargo audit could not be started: {}", failed.cause().getMessage());
            return CheckResult.degraded(Finding.of(CheckCode.AUD004,
                    "Failed to execute 'cargo audit'. Is it installed and in PATH? Error: "
                            + failed.cause().getMessage(),
                    Severity.WARNING, null));
        }
        if (outcome instanceof ProcessExecutor.TimedOut timedOut) {
            return CheckResult.degraded(Finding.of(CheckCode.AUD005,
                    "cargo-audit did not finish within " + timedOut.timeout().toSeconds()
                            + " seconds and was stopped.",
                    Severity.WARNING, projectRoot.resolve(CargoManifest.LOCK_FILE_NAME).toString()));
        }

        ProcessExecutor.Completed completed = (ProcessExecutor.Completed) outcome;
        return CheckResult.success(new AuditOutput(completed.exitCode(), completed.stdout(), completed.stderr()));
    }
}
