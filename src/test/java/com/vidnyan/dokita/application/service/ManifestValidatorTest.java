package com.vidnyan.dokita.application.service;

import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import com.vidnyan.dokita.domain.manifest.Dependency;
import com.vidnyan.dokita.domain.manifest.DependencyKind;
import com.vidnyan.dokita.domain.manifest.PackageSection;
import com.vidnyan.dokita.domain.manifest.ReadmeField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestValidatorTest {

    private final ManifestValidator validator = new ManifestValidator(new DokitaProperties());

    private static PackageSection.Builder completePackage() {
        return PackageSection.builder()
                .name("demo")
                .version("0.1.0")
                .edition("2024")
                .description("A demo crate")
                .license("MIT")
                .repository("https://example.com/demo")
                .readme(ReadmeField.path("README.md"));
    }

    private static CargoManifest manifest(PackageSection pkg) {
        return new CargoManifest(pkg, Map.of());
    }

    private static List<String> codes(List<Finding> findings) {
        return findings.stream().map(Finding::code).toList();
    }

    @Test
    void validate_ShouldAcceptCompletePackage() {
        List<Finding> findings = validator.validate(manifest(completePackage().build()), CheckRegistry.defaults());

        assertTrue(findings.isEmpty(), () -> "unexpected findings: " + findings);
    }

    @Test
    void validate_ShouldReportMissingMetadata() {
        PackageSection pkg = completePackage()
                .description("")
                .license(null)
                .repository(null)
                .readme(ReadmeField.absent())
                .build();

        List<Finding> findings = validator.validate(manifest(pkg), CheckRegistry.defaults());

        assertEquals(List.of("MD001", "MD002", "MD003", "MD004"), codes(findings));
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertEquals(Severity.WARNING, findings.get(1).severity());
        assertEquals(Severity.NOTE, findings.get(2).severity());
        assertEquals(Severity.NOTE, findings.get(3).severity());
        assertTrue(findings.stream().allMatch(f -> "Cargo.toml".equals(f.filePath())));
    }

    @ParameterizedTest
    @CsvSource({
            "description, MD001",
            "license, MD002",
            "repository, MD003",
            "readme, MD004"
    })
    void validate_ShouldReportOnlyTheRemovedField(String field, String expectedCode) {
        // Arrange
        PackageSection.Builder builder = completePackage();
        switch (field) {
            case "description" -> builder.description(null);
            case "license" -> builder.license(null);
            case "repository" -> builder.repository(null);
            case "readme" -> builder.readme(ReadmeField.absent());
            default -> fail("unknown field " + field);
        }

        // Act
        List<Finding> findings = validator.validate(manifest(builder.build()), CheckRegistry.defaults());

        // Assert
        assertEquals(List.of(expectedCode), codes(findings));
    }

    @Test
    void validate_ShouldAcceptLicenseFileInsteadOfLicense() {
        PackageSection pkg = completePackage().license(null).licenseFile("LICENSE.custom").build();

        assertTrue(validator.validate(manifest(pkg), CheckRegistry.defaults()).isEmpty());
    }

    @Test
    void validate_ShouldWarnOnMalformedReadme() {
        PackageSection pkg = completePackage().readme(ReadmeField.malformed("true")).build();

        List<Finding> findings = validator.validate(manifest(pkg), CheckRegistry.defaults());

        assertEquals(1, findings.size());
        assertEquals("MD004", findings.get(0).code());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertTrue(findings.get(0).message().contains("( 'true' )"));
    }

    @Test
    void validate_ShouldAcceptDisabledReadme() {
        PackageSection pkg = completePackage().readme(ReadmeField.disabled()).build();

        assertTrue(validator.validate(manifest(pkg), CheckRegistry.defaults()).isEmpty());
    }

    @Test
    void validate_ShouldReportOldAndMissingEdition() {
        List<Finding> old = validator.validate(manifest(completePackage().edition("2018").build()),
                CheckRegistry.defaults());
        List<Finding> missing = validator.validate(manifest(completePackage().edition(null).build()),
                CheckRegistry.defaults());

        assertEquals(List.of("ED001"), codes(old));
        assertEquals("Project uses Rust edition '2018', consider updating to '2024'.", old.get(0).message());
        assertEquals(List.of("ED002"), codes(missing));
        assertTrue(missing.get(0).message().contains("implicitly 2015"));
    }

    @Test
    void validate_ShouldUseConfiguredLatestEdition() {
        DokitaProperties properties = new DokitaProperties();
        properties.getManifest().setLatestEdition("2021");
        ManifestValidator custom = new ManifestValidator(properties);

        assertTrue(custom.validate(manifest(completePackage().edition("2021").build()),
                CheckRegistry.defaults()).isEmpty());
    }

    @Test
    void validate_ShouldReportVirtualManifestOnce() {
        List<Finding> findings = validator.validate(CargoManifest.virtualManifest(), CheckRegistry.defaults());

        assertEquals(List.of("MD005"), codes(findings));
        assertEquals(Severity.ERROR, findings.get(0).severity());
        assertEquals("Missing section [package]", findings.get(0).message());
    }

    @Test
    void validate_ShouldReportWildcardsPerRole() {
        Map<String, Dependency> runtime = new LinkedHashMap<>();
        runtime.put("serde", new Dependency.Simple("*"));
        runtime.put("pinned", new Dependency.Simple("1.2"));
        runtime.put("local", new Dependency.Detailed(null, "../local", List.of(), false));
        Map<String, Dependency> dev = Map.of("tempfile", new Dependency.Detailed("*", null, List.of(), false));
        Map<String, Dependency> build = Map.of("cc", new Dependency.Simple("*"));
        Map<DependencyKind, Map<String, Dependency>> deps = Map.of(
                DependencyKind.RUNTIME, runtime,
                DependencyKind.DEV, dev,
                DependencyKind.BUILD, build);

        List<Finding> findings = validator.validate(new CargoManifest(completePackage().build(), deps),
                CheckRegistry.defaults());

        assertEquals(List.of("DP001", "DP001", "DP001"), codes(findings));
        assertEquals("Wildcard version \"*\" used for runtime dependency 'serde'. Specify a version range.",
                findings.get(0).message());
        assertTrue(findings.get(1).message().contains("dev dependency 'tempfile'"));
        assertTrue(findings.get(2).message().contains("build dependency 'cc'"));
    }

    @Test
    void validate_ShouldSkipDisabledChecks() {
        PackageSection pkg = completePackage().description(null).repository(null).build();
        CheckRegistry registry = CheckRegistry.defaults().with("MD001", false);

        List<Finding> findings = validator.validate(manifest(pkg), registry);

        assertEquals(List.of("MD003"), codes(findings));
    }
}
