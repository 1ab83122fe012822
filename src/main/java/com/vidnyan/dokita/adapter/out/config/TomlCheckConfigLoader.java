package com.vidnyan.dokita.adapter.out.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.vidnyan.dokita.application.port.out.CheckConfigLoader;
import com.vidnyan.dokita.domain.check.CheckRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads {@value #CONFIG_FILE_NAME} from the project root.
 * Unknown sections or keys make the whole file invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TomlCheckConfigLoader implements CheckConfigLoader {

    public static final String CONFIG_FILE_NAME = ".cargo-dokita.toml";

    private final TomlMapper tomlMapper;

    @Override
    public CheckResult<CheckRegistry> load(Path projectRoot) {
        Path configPath = projectRoot.resolve(CONFIG_FILE_NAME);
        if (!Files.exists(configPath)) {
            return CheckResult.success(CheckRegistry.defaults());
        }

        try {
            String content = Files.readString(configPath);
            if (content.isBlank()) {
                return CheckResult.success(CheckRegistry.defaults());
            }
            ConfigDto config = tomlMapper.readerFor(ConfigDto.class)
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(content);
            CheckRegistry registry = toRegistry(config);
            log.info("Loaded configuration from {} ({} check switches)", CONFIG_FILE_NAME,
                    registry.enabled().size());
            return CheckResult.success(registry);
        } catch (IOException e) {
            log.warn("Ignoring invalid configuration {}: {}", configPath, e.getMessage());
            return CheckResult.degraded(Finding.of(CheckCode.CFG001,
                    "Failed to load " + CONFIG_FILE_NAME + ": " + firstLine(e.getMessage())
                            + ". Using default configuration.",
                    Severity.WARNING, CONFIG_FILE_NAME));
        }
    }

    private CheckRegistry toRegistry(ConfigDto config) {
        if (config == null || config.checks == null || config.checks.enabled == null) {
            return CheckRegistry.defaults();
        }
        Map<String, Boolean> switches = new LinkedHashMap<>();
        config.checks.enabled.forEach((code, enabled) -> {
            if (enabled != null) {
                switches.put(code, enabled);
            }
        });
        return new CheckRegistry(switches);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    // DTO classes for TOML deserialization
    static class ConfigDto {
        public GeneralDto general;
        public ChecksDto checks;
    }

    /**
     * Reserved; no keys are accepted yet.
     */
    static class GeneralDto {
    }

    static class ChecksDto {
        public Map<String, Boolean> enabled;
    }
}
