package com.vidnyan.dokita.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.vidnyan.dokita.DokitaProperties;
import com.vidnyan.dokita.application.port.out.LineRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the analyzer.
 * Wires shared infrastructure: JSON/TOML mappers, the HTTP client and the worker pools.
 */
@Slf4j
@Configuration
public class DokitaConfiguration {

    /**
     * ObjectMapper for JSON parsing and report output.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * TOML mapper for Cargo.toml and the project configuration file.
     */
    @Bean
    public TomlMapper tomlMapper() {
        return new TomlMapper();
    }

    @Bean
    public HttpClient httpClient(DokitaProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getRegistry().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Bounded pool for per-file scanning.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService scanExecutor(DokitaProperties properties) {
        int threads = properties.getScan().effectiveWorkerThreads();
        log.debug("Scan pool size: {}", threads);
        return Executors.newFixedThreadPool(threads, namedThreads("dokita-scan"));
    }

    /**
     * Two threads: one per check branch.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService checkExecutor() {
        return Executors.newFixedThreadPool(2, namedThreads("dokita-check"));
    }

    /**
     * Log available rules on startup.
     */
    @Bean
    public String logRules(LineRuleRepository ruleRepository) {
        log.debug("Registered {} line rules:", ruleRepository.findAll().size());
        ruleRepository.findAll().forEach(r -> log.debug("  - {} ({})", r.code(), r.name()));
        return "rules-logged";
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
