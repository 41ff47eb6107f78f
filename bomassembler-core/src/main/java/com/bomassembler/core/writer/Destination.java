package com.bomassembler.core.writer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where a finished document goes: a named file or standard output.
 *
 * @param file output file, null for standard output
 */
public record Destination(Path file) {

    public static Destination standardOutput() {
        return new Destination(null);
    }

    public static Destination file(Path file) {
        return new Destination(file);
    }

    /**
     * Creates a destination from a configured file name; null or blank means standard output.
     *
     * @param fileName configured file name
     * @return destination
     */
    public static Destination fromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return standardOutput();
        }
        return new Destination(Paths.get(fileName));
    }

    public boolean isStandardOutput() {
        return file == null;
    }

    @Override
    public String toString() {
        return isStandardOutput() ? "stdout" : file.toString();
    }
}
