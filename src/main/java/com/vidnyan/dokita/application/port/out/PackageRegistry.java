package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.check.CheckResult;

/**
 * Port for querying a package registry.
 */
public interface PackageRegistry {

    /**
     * Latest stable version published for a package.
     * Transport failures and non-success responses degrade to a finding.
     */
    CheckResult<String> latestStableVersion(String packageName);
}
