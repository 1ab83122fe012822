package com.vidnyan.dokita.application.error;

import java.nio.file.Path;

/**
 * The project directory has no Cargo.toml.
 */
public class NotCargoProjectException extends ProjectAnalysisException {

    public NotCargoProjectException(Path projectRoot) {
        super("Not a Cargo project (no Cargo.toml found): " + projectRoot);
    }
}
