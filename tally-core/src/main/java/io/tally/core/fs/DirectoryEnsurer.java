package io.tally.core.fs;

import io.tally.api.error.DirectoryCreationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates the output directory, including missing parents.
 * <p>
 * Succeeds when the directory already exists. The returned future completes
 * exactly once, exceptionally with {@link DirectoryCreationException} when the
 * directory cannot be created or the creation task cannot be scheduled.
 */
public class DirectoryEnsurer {

    private static final Logger log = LoggerFactory.getLogger(DirectoryEnsurer.class);

    private final Executor executor;

    public DirectoryEnsurer(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Path> ensure(Path directory) {
        CompletableFuture<Path> result = new CompletableFuture<>();
        try {
            executor.execute(() -> createDirectories(directory, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new DirectoryCreationException(directory, e));
        }
        return result;
    }

    private void createDirectories(Path directory, CompletableFuture<Path> result) {
        try {
            Files.createDirectories(directory);
            log.debug("Output directory ready: {}", directory);
            result.complete(directory);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to create output directory {}", directory, e);
            result.completeExceptionally(new DirectoryCreationException(directory, e));
        }
    }
}
