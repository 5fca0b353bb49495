package org.Aayush.panref.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * UTF-8 file backed {@link LineSource}.
 */
public final class FileLineSource implements LineSource {
    private final Path path;

    public FileLineSource(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public BufferedReader open() throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return path.toString();
    }

    public Path path() {
        return path;
    }
}
