package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;

import java.nio.file.Path;

/**
 * Port for loading per-project check configuration.
 */
public interface CheckConfigLoader {

    /**
     * Load the registry for a project. A missing file yields the default registry;
     * an invalid one degrades to a finding.
     */
    CheckResult<CheckRegistry> load(Path projectRoot);
}
