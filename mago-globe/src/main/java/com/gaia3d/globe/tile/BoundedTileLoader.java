package com.gaia3d.globe.tile;

import com.gaia3d.globe.scheduler.EventLoop;
import com.gaia3d.globe.tile.source.TileGeometryParser;
import com.gaia3d.globe.tile.source.TileParseException;
import com.gaia3d.globe.tile.source.TileSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO tile fetch scheduler with at most {@code maxConcurrent} fetches in flight.
 * Fetch results are handed back to the event loop, so records and counters only change there.
 * Failed tiles are not retried and no fetch is ever cancelled.
 */
@Slf4j
public class BoundedTileLoader {
    public static final int DEFAULT_MAX_CONCURRENT = 6;

    private final EventLoop eventLoop;
    private final TileSource tileSource;
    private final TileGeometryParser parser;
    @Getter
    private final int maxConcurrent;
    private final Deque<TileLoadJob> queue = new ArrayDeque<>();

    // written on the loop thread only, volatile for reporting threads
    private volatile long requested = 0;
    private volatile long loaded = 0;
    private volatile long failed = 0;
    private volatile int inFlight = 0;
    private volatile int queued = 0;
    private final AtomicLong rejectedCompletions = new AtomicLong();

    public BoundedTileLoader(EventLoop eventLoop, TileSource tileSource, TileGeometryParser parser) {
        this(eventLoop, tileSource, parser, DEFAULT_MAX_CONCURRENT);
    }

    public BoundedTileLoader(EventLoop eventLoop, TileSource tileSource, TileGeometryParser parser, int maxConcurrent) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("Max concurrent fetches must be positive: " + maxConcurrent);
        }
        this.eventLoop = eventLoop;
        this.tileSource = tileSource;
        this.parser = parser;
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Fetch results dropped because the event loop no longer accepted tasks.
     */
    public long getRejectedCompletions() {
        return rejectedCompletions.get();
    }

    /**
     * Queues a pending record. The continuation runs on the loop thread once the record is terminal,
     * whether it loaded or failed.
     */
    void enqueue(TileRecord record, Runnable continuation) {
        if (record.getStatus() != TileStatus.PENDING) {
            throw new IllegalStateException("Only pending tiles can be loaded: " + record);
        }
        queue.addLast(new TileLoadJob(record, continuation));
        requested++;
        queued = queue.size();
        pump();
    }

    private void pump() {
        while (inFlight < maxConcurrent && !queue.isEmpty()) {
            TileLoadJob job = queue.pollFirst();
            queued = queue.size();
            dispatch(job);
        }
    }

    private void dispatch(TileLoadJob job) {
        inFlight++;
        TileDescriptor descriptor = job.getRecord().getDescriptor();
        log.debug("[Tile][Loader] fetching {} ({} in flight, {} queued)", descriptor.getId(), inFlight, queued);

        CompletableFuture<Geometry> result;
        try {
            result = tileSource.fetch(descriptor).thenApply(parser::parse);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete((geometry, throwable) -> handBack(job, geometry, throwable));
    }

    /**
     * Runs on the fetching thread. A loop that was shut down drops the result and the record stays pending.
     */
    private void handBack(TileLoadJob job, Geometry geometry, Throwable throwable) {
        try {
            eventLoop.execute(() -> complete(job, geometry, throwable));
        } catch (RejectedExecutionException e) {
            rejectedCompletions.incrementAndGet();
            log.warn("[Tile][Loader] event loop rejected the result of {}, was the session closed?",
                    job.getRecord().getId());
        }
    }

    private void complete(TileLoadJob job, Geometry geometry, Throwable throwable) {
        inFlight--;
        TileRecord record = job.getRecord();
        if (throwable == null) {
            record.markLoaded(geometry);
            loaded++;
            log.debug("[Tile][Loader] loaded {} ({} geometries)", record.getId(), geometry.getNumGeometries());
        } else {
            Throwable cause = unwrap(throwable);
            TileFailureReason reason = cause instanceof TileParseException ? TileFailureReason.PARSE : TileFailureReason.TRANSPORT;
            record.markFailed(reason);
            failed++;
            log.warn("[Tile][Loader] failed {} ({}): {}", record.getId(), reason, cause.getMessage());
        }

        try {
            job.getContinuation().run();
        } catch (RuntimeException e) {
            log.error("[Tile][Loader] continuation of {} failed", record.getId(), e);
        }
        pump();
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    public TileLoaderStats getStats() {
        return new TileLoaderStats(requested, loaded, failed, inFlight, queued);
    }
}
