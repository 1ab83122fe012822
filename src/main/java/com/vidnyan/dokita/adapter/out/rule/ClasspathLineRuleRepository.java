package com.vidnyan.dokita.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.application.port.out.LineRuleRepository;
import com.vidnyan.dokita.domain.finding.Severity;
import com.vidnyan.dokita.domain.rule.LineRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classpath based line rule repository.
 * Loads rules from JSON files matching the configured location pattern.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClasspathLineRuleRepository implements LineRuleRepository {

    private final ObjectMapper objectMapper;
    private final DokitaProperties properties;

    private volatile List<LineRule> rules = List.of();

    @PostConstruct
    public void loadRules() {
        String location = properties.getRules().getLocation();
        List<RuleDto> loaded = new ArrayList<>();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(location);

            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    RuleDto dto = objectMapper.readValue(in, RuleDto.class);
                    validate(dto);
                    loaded.add(dto);
                    log.debug("Loaded rule: {} - {}", dto.id, dto.name);
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Failed to load rule from {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to load rules from {}", location, e);
        }

        rules = loaded.stream()
                .sorted(Comparator.comparingInt((RuleDto dto) -> dto.order).thenComparing(dto -> dto.id))
                .map(this::mapToRule)
                .toList();
        log.info("Loaded {} line rules from {}", rules.size(), location);
    }

    @Override
    public List<LineRule> findAll() {
        return rules;
    }

    private void validate(RuleDto dto) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new IllegalArgumentException("rule has no id");
        }
        if (dto.pattern == null || dto.pattern.isEmpty()) {
            throw new IllegalArgumentException("rule " + dto.id + " has no pattern");
        }
        if (dto.message == null) {
            throw new IllegalArgumentException("rule " + dto.id + " has no message");
        }
        // Compile early so a bad pattern drops only this rule.
        Pattern.compile(dto.pattern);
    }

    private LineRule mapToRule(RuleDto dto) {
        return new LineRule(
                dto.id,
                dto.name != null ? dto.name : dto.id,
                mapSeverity(dto.severity),
                Pattern.compile(dto.pattern),
                mapScope(dto.scope),
                dto.message);
    }

    private Severity mapSeverity(String severity) {
        if (severity == null) return Severity.WARNING;
        return switch (severity.toUpperCase()) {
            case "ERROR" -> Severity.ERROR;
            case "NOTE", "INFO" -> Severity.NOTE;
            default -> Severity.WARNING;
        };
    }

    private LineRule.Scope mapScope(String scope) {
        if (scope == null) return LineRule.Scope.LIBRARY;
        return "ALL".equalsIgnoreCase(scope) ? LineRule.Scope.ALL : LineRule.Scope.LIBRARY;
    }

    // DTO class for JSON deserialization
    static class RuleDto {
        public String id;
        public String name;
        public int order;
        public String severity;
        public String scope;
        public String pattern;
        public String message;
    }
}
