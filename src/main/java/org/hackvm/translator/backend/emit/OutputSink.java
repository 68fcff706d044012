package org.hackvm.translator.backend.emit;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The destination of a translated program. It is opened once, when the translator is closed,
 * and the returned writer is closed by the caller.
 */
@FunctionalInterface
public interface OutputSink {

    /**
     * Opens the destination for writing.
     *
     * @return A fresh writer owned by the caller.
     * @throws IOException if the destination cannot be opened.
     */
    Writer open() throws IOException;

    /**
     * @param file The file to create or truncate (UTF-8).
     * @return A sink writing to the file.
     */
    static OutputSink toFile(Path file) {
        return () -> Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }
}
