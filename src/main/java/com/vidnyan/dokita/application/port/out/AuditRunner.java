package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.check.CheckResult;

import java.nio.file.Path;

/**
 * Port for running the external vulnerability audit tool.
 */
public interface AuditRunner {

    /**
     * Run the audit in {@code projectRoot}. Degrades when the tool cannot be started
     * or does not finish in time.
     */
    CheckResult<AuditOutput> run(Path projectRoot);

    /**
     * Raw result of a finished audit process.
     */
    record AuditOutput(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
