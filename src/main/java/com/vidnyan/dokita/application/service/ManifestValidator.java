package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import com.vidnyan.dokita.domain.manifest.Dependency;
import com.vidnyan.dokita.domain.manifest.DependencyKind;
import com.vidnyan.dokita.domain.manifest.PackageSection;
import com.vidnyan.dokita.domain.manifest.ReadmeField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates package metadata, dependency version requirements and the edition.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestValidator {

    private static final String IMPLICIT_EDITION = "2015";

    private final DokitaProperties properties;

    public List<Finding> validate(CargoManifest manifest, CheckRegistry registry) {
        List<Finding> findings = new ArrayList<>();
        if (manifest.hasPackage()) {
            checkMetadata(manifest.packageSection(), registry, findings);
            checkEdition(manifest.packageSection(), registry, findings);
        } else {
            findings.add(finding(CheckCode.MD005, "Missing section [package]", Severity.ERROR));
        }
        if (registry.isEnabled(CheckCode.DP001)) {
            checkWildcards(manifest, findings);
        }
        log.debug("Manifest validation produced {} findings", findings.size());
        return findings;
    }

    private void checkMetadata(PackageSection pkg, CheckRegistry registry, List<Finding> findings) {
        if (registry.isEnabled(CheckCode.MD001) && PackageSection.isBlank(pkg.description())) {
            findings.add(finding(CheckCode.MD001,
                    "Missing 'description' in [package] section of Cargo.toml.", Severity.WARNING));
        }
        if (registry.isEnabled(CheckCode.MD002) && !pkg.declaresLicense()) {
            findings.add(finding(CheckCode.MD002,
                    "Missing 'license' (or 'license-file') in [package] section of Cargo.toml.", Severity.WARNING));
        }
        if (registry.isEnabled(CheckCode.MD003) && PackageSection.isBlank(pkg.repository())) {
            findings.add(finding(CheckCode.MD003,
                    "Missing 'repository' in [package] section of Cargo.toml.", Severity.NOTE));
        }
        if (registry.isEnabled(CheckCode.MD004)) {
            ReadmeField readme = pkg.readme();
            switch (readme.kind()) {
                case ABSENT -> findings.add(finding(CheckCode.MD004,
                        "Missing 'readme' field in [package] section of Cargo.toml. "
                                + "Consider adding `readme = \"README.md\"` or `readme = false`.",
                        Severity.NOTE));
                case MALFORMED -> findings.add(finding(CheckCode.MD004,
                        "The 'readme' field in Cargo.toml has an unexpected value ( '" + readme.rawValue()
                                + "' ). Expected a file path string (e.g., \"README.md\") or `false`.",
                        Severity.WARNING));
                default -> {
                    // a path or false are both fine
                }
            }
        }
    }

    private void checkEdition(PackageSection pkg, CheckRegistry registry, List<Finding> findings) {
        String latest = properties.getManifest().getLatestEdition();
        String edition = pkg.edition();
        if (edition == null) {
            if (registry.isEnabled(CheckCode.ED002)) {
                findings.add(finding(CheckCode.ED002,
                        "Project does not specify a Rust edition (implicitly " + IMPLICIT_EDITION
                                + "), consider specifying and updating to '" + latest + "'.",
                        Severity.NOTE));
            }
        } else if (!edition.equals(latest) && registry.isEnabled(CheckCode.ED001)) {
            findings.add(finding(CheckCode.ED001,
                    "Project uses Rust edition '" + edition + "', consider updating to '" + latest + "'.",
                    Severity.NOTE));
        }
    }

    private void checkWildcards(CargoManifest manifest, List<Finding> findings) {
        for (DependencyKind kind : DependencyKind.values()) {
            for (Map.Entry<String, Dependency> entry : manifest.dependencies(kind).entrySet()) {
                if (entry.getValue().isWildcard()) {
                    findings.add(finding(CheckCode.DP001,
                            "Wildcard version \"*\" used for " + kind.role() + " dependency '"
                                    + entry.getKey() + "'. Specify a version range.",
                            Severity.WARNING));
                }
            }
        }
    }

    private static Finding finding(CheckCode code, String message, Severity severity) {
        return Finding.of(code, message, severity, CargoManifest.FILE_NAME);
    }
}
