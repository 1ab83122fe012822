package com.vidnyan.dokita.application.error;

import java.nio.file.Path;

/**
 * The project path does not exist or cannot be canonicalized.
 */
public class UnresolvableProjectPathException extends ProjectAnalysisException {

    public UnresolvableProjectPathException(Path path, Throwable cause) {
        super("Could not resolve project path " + path + ": " + cause.getMessage(), cause);
    }
}
