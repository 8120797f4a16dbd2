package com.ledgerengine.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class CsvFiles {

    private CsvFiles() {
    }

    /**
     * Opens a UTF-8 writer, creating missing parent directories and truncating an existing file.
     */
    static BufferedWriter newWriter(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }
}
