package com.jsconformance.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A single conformance test file.
 *
 * The relative path (always '/' separated) is the key used both for directory
 * aggregation and for per-file reporting.
 */
public record TestFile(Path path, String relativePath) implements Comparable<TestFile> {

    public TestFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(relativePath, "relativePath");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    public static TestFile of(Path corpusRoot, Path file) {
        Path root = corpusRoot.toAbsolutePath().normalize();
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            throw new IllegalArgumentException(file + " is not inside " + corpusRoot);
        }
        Path relative = root.relativize(absolute);
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return new TestFile(absolute, String.join("/", parts));
    }

    /**
     * Directory segments from the corpus root down to the file's parent.
     * Empty for a file that sits directly in the corpus root.
     */
    public List<String> directorySegments() {
        String[] parts = relativePath.split("/");
        List<String> segments = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length - 1; i++) {
            segments.add(parts[i]);
        }
        return segments;
    }

    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    @Override
    public int compareTo(TestFile other) {
        return relativePath.compareTo(other.relativePath);
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
