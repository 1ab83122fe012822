package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.manifest.CargoManifest;

import java.nio.file.Path;

/**
 * Port for loading the project manifest.
 */
public interface ManifestReader {

    /**
     * Parse the manifest file.
     * @throws com.vidnyan.dokita.application.error.ManifestParseException when the file
     *         cannot be read or is not valid TOML
     */
    CargoManifest read(Path manifestPath);
}
