package io.tally.core.fs;

import java.nio.file.Path;

/**
 * Turns a configured output path into an absolute one.
 * Absolute paths are returned as given; relative paths are resolved against a
 * working directory and normalized.
 */
public final class PathResolver {

    private final Path workingDirectory;

    public PathResolver() {
        this(Path.of(System.getProperty("user.dir")));
    }

    public PathResolver(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
    }

    public Path resolve(String path) {
        return resolve(path, workingDirectory);
    }

    public Path resolve(String path, Path cwd) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return candidate;
        }
        return cwd.toAbsolutePath().resolve(candidate).normalize();
    }

    public Path workingDirectory() {
        return workingDirectory;
    }
}
