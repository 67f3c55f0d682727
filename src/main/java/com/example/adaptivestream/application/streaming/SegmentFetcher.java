package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.Chunk;
import com.example.adaptivestream.domain.model.ChunkKey;
import com.example.adaptivestream.domain.model.ChunkStatus;
import com.example.adaptivestream.domain.model.TimeSpan;
import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-session segment downloader with a bounded number of in-flight requests.
 *
 * <p>Requests beyond the limit wait in a queue ordered by priority, then arrival. Cancelling a
 * request's future aborts its transfer and frees its slot at once, so the next queued request
 * starts without waiting for the aborted one to unwind. Workers are started outside the
 * internal lock and futures are completed outside it too.
 */
public class SegmentFetcher {

    private static final Logger log = LoggerFactory.getLogger(SegmentFetcher.class);

    private static final Comparator<Task> QUEUE_ORDER = Comparator
            .comparing((Task t) -> !t.request.isHighPriority())
            .thenComparingLong(t -> t.sequence);

    private final Executor executor;
    private final SegmentTransport transport;
    private final int maxConcurrent;
    private final Clock clock;
    private final BandwidthEstimator bandwidthEstimator;
    private final ChunkCache cache;
    private final AtomicLong sequence = new AtomicLong();

    private final Object lock = new Object();
    private final PriorityQueue<Task> queue = new PriorityQueue<>(QUEUE_ORDER);
    private final Set<Task> inFlight = new LinkedHashSet<>();
    private boolean disposed;

    public SegmentFetcher(Executor executor,
                          SegmentTransport transport,
                          int maxConcurrent,
                          Clock clock,
                          BandwidthEstimator bandwidthEstimator,
                          ChunkCache cache) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive");
        }
        this.executor = executor;
        this.transport = transport;
        this.maxConcurrent = maxConcurrent;
        this.clock = clock;
        this.bandwidthEstimator = bandwidthEstimator;
        this.cache = cache;
    }

    /**
     * Schedules a fetch. The future completes with the loaded chunk, completes exceptionally with
     * a {@link FetchException}, or is cancelled. A cached chunk is returned without a request.
     */
    public CompletableFuture<Chunk> submit(SegmentRequest request, String providerName, URI uri) {
        ChunkKey key = request.chunkKey();
        Chunk cached = cache.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        Chunk chunk = new Chunk(key, request.getSpan(), request.getByteRange(), request.getTier(), providerName);
        Task task = new Task(request, chunk, uri, sequence.incrementAndGet());
        synchronized (lock) {
            if (disposed) {
                chunk.markAborted();
                CompletableFuture<Chunk> rejected = new CompletableFuture<>();
                rejected.cancel(false);
                return rejected;
            }
            queue.add(task);
        }
        task.future.whenComplete((result, error) -> {
            if (task.future.isCancelled()) {
                onCancelled(task);
            }
        });
        drain();
        return task.future;
    }

    /**
     * Cancels every queued or in-flight request matching the predicate.
     *
     * @return number of requests cancelled
     */
    public int cancelWhere(Predicate<SegmentRequest> predicate) {
        List<Task> matched = new ArrayList<>();
        synchronized (lock) {
            for (Task task : queue) {
                if (predicate.test(task.request)) {
                    matched.add(task);
                }
            }
            for (Task task : inFlight) {
                if (predicate.test(task.request)) {
                    matched.add(task);
                }
            }
        }
        int cancelled = 0;
        for (Task task : matched) {
            if (task.future.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int cancelAll() {
        return cancelWhere(r -> true);
    }

    /**
     * Spans of queued and in-flight requests.
     */
    public List<TimeSpan> outstandingSpans() {
        List<TimeSpan> spans = new ArrayList<>();
        synchronized (lock) {
            for (Task task : inFlight) {
                spans.add(task.request.getSpan());
            }
            for (Task task : queue) {
                spans.add(task.request.getSpan());
            }
        }
        return spans;
    }

    public int outstandingCount() {
        synchronized (lock) {
            return inFlight.size() + queue.size();
        }
    }

    public int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    public int queuedCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public BandwidthEstimator getBandwidthEstimator() {
        return bandwidthEstimator;
    }

    public Chunk cachedChunk(ChunkKey key) {
        return cache.get(key);
    }

    public void release(ChunkKey key) {
        cache.remove(key);
    }

    /**
     * Cancels everything and drops the cache. Later calls do nothing.
     *
     * @return true on the first call
     */
    public boolean dispose() {
        synchronized (lock) {
            if (disposed) {
                return false;
            }
            disposed = true;
        }
        int cancelled = cancelAll();
        cache.clear();
        log.debug("SEGMENT_FETCHER_DISPOSED cancelled={}", cancelled);
        return true;
    }

    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    private void onCancelled(Task task) {
        task.chunk.markAborted();
        boolean wasRunning;
        synchronized (lock) {
            queue.remove(task);
            wasRunning = inFlight.remove(task);
        }
        if (wasRunning) {
            task.cancellation.cancel();
        }
        drain();
    }

    private void drain() {
        List<Task> toStart = new ArrayList<>();
        synchronized (lock) {
            while (!disposed && inFlight.size() < maxConcurrent && !queue.isEmpty()) {
                Task next = queue.poll();
                inFlight.add(next);
                toStart.add(next);
            }
        }
        for (Task task : toStart) {
            try {
                executor.execute(() -> run(task));
            } catch (RejectedExecutionException e) {
                log.warn("SEGMENT_FETCH_REJECTED request={} reason={}", task.request, e.getMessage());
                finish(task);
                task.chunk.markFailed();
                task.future.completeExceptionally(FetchException.transientFailure("fetch worker rejected", e));
            }
        }
    }

    private void run(Task task) {
        if (task.future.isDone()) {
            return;
        }
        long startedAt = clock.nowMs();
        try {
            byte[] data = transport.fetch(task.uri, task.request.getByteRange(), task.cancellation);
            long elapsed = clock.nowMs() - startedAt;
            if (!finish(task)) {
                return;
            }
            bandwidthEstimator.record(data.length, elapsed);
            if (task.chunk.markLoaded(data)) {
                cache.put(task.chunk);
            }
            task.future.complete(task.chunk);
        } catch (FetchException e) {
            if (finish(task)) {
                task.chunk.markFailed();
                task.future.completeExceptionally(e);
            }
        } catch (RuntimeException e) {
            if (finish(task)) {
                task.chunk.markFailed();
                task.future.completeExceptionally(
                        FetchException.transientFailure("fetch failed: " + e.getMessage(), e));
            }
        } finally {
            drain();
        }
    }

    /**
     * Frees the task's slot. False when it was already freed by a cancellation.
     */
    private boolean finish(Task task) {
        synchronized (lock) {
            return inFlight.remove(task);
        }
    }

    public ChunkStatus status(ChunkKey key) {
        if (cache.get(key) != null) {
            return ChunkStatus.LOADED;
        }
        synchronized (lock) {
            for (Task task : inFlight) {
                if (task.chunk.getKey().equals(key)) {
                    return task.chunk.getStatus();
                }
            }
            for (Task task : queue) {
                if (task.chunk.getKey().equals(key)) {
                    return task.chunk.getStatus();
                }
            }
        }
        return null;
    }

    private static final class Task {

        private final SegmentRequest request;
        private final Chunk chunk;
        private final URI uri;
        private final long sequence;
        private final CompletableFuture<Chunk> future = new CompletableFuture<>();
        private final FetchCancellation cancellation = new FetchCancellation();

        private Task(SegmentRequest request, Chunk chunk, URI uri, long sequence) {
            this.request = request;
            this.chunk = chunk;
            this.uri = uri;
            this.sequence = sequence;
        }
    }
}
