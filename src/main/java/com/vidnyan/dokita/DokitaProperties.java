package com.vidnyan.dokita;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analyzer.
 * Can be configured via application.yml or command line ({@code --dokita.registry.timeout=10s}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "dokita")
public class DokitaProperties {

    private Registry registry = new Registry();
    private Audit audit = new Audit();
    private Metadata metadata = new Metadata();
    private Scan scan = new Scan();
    private Manifest manifest = new Manifest();
    private Rules rules = new Rules();

    @Data
    public static class Registry {
        /**
         * Base URL of the crates API; the package name is appended.
         */
        private String baseUrl = "https://crates.io/api/v1/crates";

        /**
         * crates.io rejects requests without a descriptive User-Agent.
         */
        private String userAgent = "cargo-dokita-java/0.1.0 (https://github.com/vidnyan/dokita)";

        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Audit {
        private List<String> command = new ArrayList<>(List.of("cargo", "audit", "--json", "--quiet"));
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Metadata {
        private List<String> command = new ArrayList<>(List.of("cargo", "metadata", "--format-version", "1"));
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Scan {
        /**
         * Worker threads for file scanning; 0 means one per available processor.
         */
        private int workerThreads = 0;

        public int effectiveWorkerThreads() {
            return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        }
    }

    @Data
    public static class Manifest {
        private String latestEdition = "2024";

        /**
         * Lints every crate root should deny.
         */
        private List<String> recommendedDeniedLints = new ArrayList<>(List.of("warnings"));
    }

    @Data
    public static class Rules {
        private String location = "classpath*:rules/*.json";
    }
}
