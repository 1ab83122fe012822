package com.vidnyan.dokita.domain.manifest;

/**
 * The [package] table of Cargo.toml.
 * String fields are null when absent.
 */
public record PackageSection(
    String name,
    String version,
    String edition,
    String description,
    String license,
    String licenseFile,
    ReadmeField readme,
    String repository
) {

    public PackageSection {
        readme = readme == null ? ReadmeField.absent() : readme;
    }

    /**
     * Whether a license identifier or license file is declared.
     */
    public boolean declaresLicense() {
        return !isBlank(license) || !isBlank(licenseFile);
    }

    /**
     * Crate name as Rust sees it (hyphens become underscores).
     */
    public String libraryName() {
        return name == null ? null : name.replace('-', '_');
    }

    public static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String version;
        private String edition;
        private String description;
        private String license;
        private String licenseFile;
        private ReadmeField readme = ReadmeField.absent();
        private String repository;

        public Builder name(String name) { this.name = name; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder edition(String edition) { this.edition = edition; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder license(String license) { this.license = license; return this; }
        public Builder licenseFile(String licenseFile) { this.licenseFile = licenseFile; return this; }
        public Builder readme(ReadmeField readme) { this.readme = readme; return this; }
        public Builder repository(String repository) { this.repository = repository; return this; }

        public PackageSection build() {
            return new PackageSection(name, version, edition, description, license, licenseFile,
                    readme, repository);
        }
    }
}
