package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import com.vidnyan.dokita.domain.manifest.PackageSection;
import com.vidnyan.dokita.domain.manifest.ReadmeField;
import com.vidnyan.dokita.domain.rule.FileContextClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File system checks on the project layout: build targets, README, LICENSE and
 * crate-level lint directives.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectStructureChecker {

    static final List<String> README_FILES = List.of("README.md", "README.rst");
    static final List<String> LICENSE_FILES = List.of(
            "LICENSE", "LICENSE.txt", "LICENSE.md", "LICENSE-MIT", "LICENSE-APACHE", "COPYING", "UNLICENSE");

    private static final Pattern DENY_DIRECTIVE = Pattern.compile("#!\\[deny\\(([^)]+)\\)\\]");

    private final DokitaProperties properties;

    public List<Finding> check(Path projectRoot, CargoManifest manifest, CheckRegistry registry) {
        List<Finding> findings = new ArrayList<>();
        PackageSection pkg = manifest.packageSection();

        if (pkg != null && !hasBuildTarget(projectRoot, pkg)) {
            findings.add(Finding.of(CheckCode.STRUCT001,
                    "Project has neither src/lib.rs, src/main.rs, nor src/bin/ directory. "
                            + "Is it a virtual workspace or missing source files?",
                    Severity.WARNING, CargoManifest.FILE_NAME));
        }
        if (registry.isEnabled(CheckCode.STRUCT002) && !hasReadme(projectRoot, pkg)) {
            findings.add(Finding.of(CheckCode.STRUCT002,
                    "Missing README.md file in project root. Consider adding one.",
                    Severity.NOTE, README_FILES.get(0)));
        }
        if (registry.isEnabled(CheckCode.STRUCT003) && !hasLicense(projectRoot, pkg)) {
            findings.add(Finding.of(CheckCode.STRUCT003,
                    "Missing LICENSE file in project root. Consider adding one (e.g., LICENSE-MIT or LICENSE-APACHE).",
                    Severity.WARNING, LICENSE_FILES.get(0)));
        }
        if (registry.isEnabled(CheckCode.LINT001)) {
            checkDeniedLints(projectRoot, findings);
        }
        return findings;
    }

    private boolean hasBuildTarget(Path projectRoot, PackageSection pkg) {
        Path src = projectRoot.resolve(FileContextClassifier.SOURCE_DIR);
        if (Files.isRegularFile(src.resolve(FileContextClassifier.LIBRARY_ROOT))
                || Files.isRegularFile(src.resolve(FileContextClassifier.ENTRY_POINT))
                || Files.isDirectory(src.resolve(FileContextClassifier.BINARIES_DIR))) {
            return true;
        }
        String libraryName = pkg.libraryName();
        return libraryName != null && Files.exists(src.resolve(libraryName + ".rs"));
    }

    private boolean hasReadme(Path projectRoot, PackageSection pkg) {
        if (README_FILES.stream().anyMatch(name -> Files.isRegularFile(projectRoot.resolve(name)))) {
            return true;
        }
        if (pkg == null) {
            return false;
        }
        ReadmeField readme = pkg.readme();
        return readme.kind() == ReadmeField.Kind.DISABLED
                || (readme.kind() == ReadmeField.Kind.PATH && Files.isRegularFile(projectRoot.resolve(readme.path())));
    }

    private boolean hasLicense(Path projectRoot, PackageSection pkg) {
        if (pkg != null && pkg.declaresLicense()) {
            return true;
        }
        return LICENSE_FILES.stream()
                .flatMap(name -> Arrays.stream(new String[] {
                        name, name.toUpperCase(Locale.ROOT), name.toLowerCase(Locale.ROOT)}))
                .anyMatch(name -> Files.isRegularFile(projectRoot.resolve(name)));
    }

    private void checkDeniedLints(Path projectRoot, List<Finding> findings) {
        List<String> recommended = properties.getManifest().getRecommendedDeniedLints();
        for (String crateRoot : List.of(FileContextClassifier.LIBRARY_ROOT, FileContextClassifier.ENTRY_POINT)) {
            Path file = projectRoot.resolve(FileContextClassifier.SOURCE_DIR).resolve(crateRoot);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            Set<String> denied;
            try {
                denied = deniedLints(Files.readString(file));
            } catch (IOException e) {
                // the pattern scan already reports unreadable sources
                log.debug("Skipping lint check for {}: {}", file, e.getMessage());
                continue;
            }
            for (String lint : recommended) {
                if (!denied.contains(lint)) {
                    findings.add(Finding.of(CheckCode.LINT001,
                            "Consider adding `#![deny(" + lint + ")]` to the top of " + crateRoot
                                    + " for stricter linting.",
                            Severity.NOTE, FileContextClassifier.SOURCE_DIR + "/" + crateRoot));
                }
            }
        }
    }

    static Set<String> deniedLints(String content) {
        Set<String> denied = new HashSet<>();
        Matcher matcher = DENY_DIRECTIVE.matcher(content);
        while (matcher.find()) {
            for (String lint : matcher.group(1).split(",")) {
                denied.add(lint.trim());
            }
        }
        return denied;
    }
}
