package com.vidnyan.dokita.adapter.out.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.application.port.out.PackageRegistry;
import com.vidnyan.dokita.domain.check.CheckResult;
import com.vidnyan.dokita.domain.finding.CheckCode;
import com.vidnyan.dokita.domain.finding.Finding;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.version.SemanticVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * crates.io client for latest-version lookups.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CratesIoRegistryClient implements PackageRegistry {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DokitaProperties properties;

    @Override
    public CheckResult<String> latestStableVersion(String packageName) {
        DokitaProperties.Registry registry = properties.getRegistry();
        String url = registry.getBaseUrl() + "/" + URLEncoder.encode(packageName, StandardCharsets.UTF_8);
        log.debug("Registry request: {}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", registry.getUserAgent())
                .header("Accept", "application/json")
                .timeout(registry.getTimeout())
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("Registry lookup for {} failed with status {}", packageName, response.statusCode());
                return failure(packageName, "crates.io API request for " + packageName
                        + " failed with status: " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            Optional<String> latest = selectLatest(root);
            if (latest.isEmpty()) {
                return failure(packageName, "crates.io response for " + packageName + " lists no stable version");
            }
            log.debug("Latest {} on registry: {}", packageName, latest.get());
            return CheckResult.success(latest.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(packageName, "request interrupted");
        } catch (IOException e) {
            log.warn("Registry lookup for {} failed: {}", packageName, e.toString());
            return failure(packageName, "Failed to send request to crates.io for " + packageName + ": " + e);
        }
    }

    /**
     * {@code crate.max_stable_version}, then {@code crate.max_version}, then the highest
     * non-yanked release in {@code versions}.
     */
    static Optional<String> selectLatest(JsonNode root) {
        JsonNode crate = root.path("crate");
        for (String field : new String[] {"max_stable_version", "max_version"}) {
            JsonNode value = crate.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }

        SemanticVersion best = null;
        for (JsonNode version : root.path("versions")) {
            if (version.path("yanked").asBoolean(false)) {
                continue;
            }
            Optional<SemanticVersion> parsed = SemanticVersion.parse(version.path("num").asText(""));
            if (parsed.isPresent() && !parsed.get().isPreRelease()
                    && (best == null || parsed.get().compareTo(best) > 0)) {
                best = parsed.get();
            }
        }
        return Optional.ofNullable(best).map(SemanticVersion::toString);
    }

    private static CheckResult<String> failure(String packageName, String reason) {
        return CheckResult.degraded(Finding.of(CheckCode.API001,
                "Failed to fetch latest version for dependency '" + packageName + "': " + reason,
                Severity.WARNING, null));
    }
}
