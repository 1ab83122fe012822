package com.vidnyan.dokita.adapter.out.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.vidnyan.dokita.application.error.ManifestParseException;
import com.vidnyan.dokita.application.port.out.ManifestReader;
import com.vidnyan.dokita.domain.manifest.CargoManifest;
import com.vidnyan.dokita.domain.manifest.Dependency;
import com.vidnyan.dokita.domain.manifest.DependencyKind;
import com.vidnyan.dokita.domain.manifest.PackageSection;
import com.vidnyan.dokita.domain.manifest.ReadmeField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson TOML based implementation of ManifestReader.
 * Reads Cargo.toml into a tree and maps the parts the checks need.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TomlManifestReader implements ManifestReader {

    private final TomlMapper tomlMapper;

    @Override
    public CargoManifest read(Path manifestPath) {
        JsonNode root;
        try {
            root = tomlMapper.readTree(Files.readString(manifestPath));
        } catch (IOException e) {
            throw new ManifestParseException(manifestPath, e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestParseException(manifestPath,
                    new IOException("manifest is not a TOML table"));
        }

        Map<DependencyKind, Map<String, Dependency>> dependencies = new EnumMap<>(DependencyKind.class);
        for (DependencyKind kind : DependencyKind.values()) {
            dependencies.put(kind, mapDependencies(root.path(kind.tableName())));
        }

        CargoManifest manifest = new CargoManifest(mapPackage(root.get("package")), dependencies);
        log.debug("Parsed {}: package={}, {} runtime dependencies", manifestPath,
                manifest.hasPackage() ? manifest.packageSection().name() : "<virtual>",
                manifest.dependencies(DependencyKind.RUNTIME).size());
        return manifest;
    }

    private PackageSection mapPackage(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return PackageSection.builder()
                .name(text(node, "name"))
                .version(text(node, "version"))
                .edition(text(node, "edition"))
                .description(text(node, "description"))
                .license(text(node, "license"))
                .licenseFile(text(node, "license-file"))
                .readme(mapReadme(node.get("readme")))
                .repository(text(node, "repository"))
                .build();
    }

    private ReadmeField mapReadme(JsonNode node) {
        if (node == null || node.isNull()) {
            return ReadmeField.absent();
        }
        if (node.isTextual()) {
            return ReadmeField.path(node.asText());
        }
        if (node.isBoolean() && !node.booleanValue()) {
            return ReadmeField.disabled();
        }
        return ReadmeField.malformed(node.toString());
    }

    private Map<String, Dependency> mapDependencies(JsonNode table) {
        Map<String, Dependency> dependencies = new LinkedHashMap<>();
        if (!table.isObject()) {
            return dependencies;
        }
        table.fields().forEachRemaining(entry -> {
            JsonNode declaration = entry.getValue();
            if (declaration.isTextual()) {
                dependencies.put(entry.getKey(), new Dependency.Simple(declaration.asText()));
            } else if (declaration.isObject()) {
                dependencies.put(entry.getKey(), new Dependency.Detailed(
                        text(declaration, "version"),
                        text(declaration, "path"),
                        stringList(declaration.get("features")),
                        declaration.path("workspace").asBoolean(false)));
            } else {
                log.debug("Ignoring dependency '{}' with unsupported value {}", entry.getKey(), declaration);
            }
        });
        return dependencies;
    }

    /**
     * String value of a field; null when absent or not a string (e.g. {@code version.workspace = true}).
     */
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }
}
