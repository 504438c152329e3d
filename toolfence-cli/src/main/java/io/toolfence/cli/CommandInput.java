package io.toolfence.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads command input from a file argument, or from standard input when the argument is absent
 * or {@code -}.
 */
final class CommandInput {

    private CommandInput() {
    }

    static String read(Path file, InputStream stdin) throws IOException {
        if (file == null || "-".equals(file.toString())) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
