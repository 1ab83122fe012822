package com.vidnyan.dokita;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dokita - health checks for Cargo projects.
 *
 * Scans Rust sources and Cargo.toml, checks dependencies against crates.io and runs
 * cargo-audit, then reports the findings.
 */
@SpringBootApplication
public class DokitaApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DokitaApplication.class, args)));
    }
}
