package com.gaia3d.globe.tile.source;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Reads tiles from a local directory on a small pool of daemon I/O threads.
 */
@Slf4j
public class FileTileSource implements TileSource, AutoCloseable {
    private static final int IO_THREADS = 4;

    @Getter
    private final Path rootDirectory;
    @Getter
    private final TileNameTemplate nameTemplate;
    private final ExecutorService ioExecutor;

    public FileTileSource(Path rootDirectory) {
        this(rootDirectory, new TileNameTemplate());
    }

    public FileTileSource(Path rootDirectory, TileNameTemplate nameTemplate) {
        this.rootDirectory = rootDirectory;
        this.nameTemplate = nameTemplate;
        this.ioExecutor = Executors.newFixedThreadPool(IO_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "globe-tile-io");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<byte[]> fetchResource(String resourceName) {
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        ioExecutor.execute(() -> {
            try {
                future.complete(read(resourceName));
            } catch (TileFetchException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    private byte[] read(String resourceName) throws TileFetchException {
        Path path = rootDirectory.resolve(resourceName).normalize();
        if (!path.startsWith(rootDirectory.normalize())) {
            throw new TileFetchException("Resource escapes the tile directory: " + resourceName);
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            log.debug("[Tile][I/O] read {} ({} bytes)", path, bytes.length);
            return bytes;
        } catch (NoSuchFileException e) {
            throw new TileFetchException("Tile not found: " + path, e);
        } catch (IOException e) {
            throw new TileFetchException("Failed to read tile: " + path, e);
        }
    }

    @Override
    public void close() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ioExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
