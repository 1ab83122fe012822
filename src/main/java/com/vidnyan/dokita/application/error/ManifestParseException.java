package com.vidnyan.dokita.application.error;

import java.nio.file.Path;

/**
 * Cargo.toml exists but cannot be read or parsed.
 */
public class ManifestParseException extends ProjectAnalysisException {

    public ManifestParseException(Path manifestPath, Throwable cause) {
        super("Failed to parse " + manifestPath + ": " + cause.getMessage(), cause);
    }
}
