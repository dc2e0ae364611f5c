package com.opstranslate.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by a translation run, in write order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
