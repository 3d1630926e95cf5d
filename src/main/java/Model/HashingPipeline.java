package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fingerprints many files on a fixed pool of worker threads.
 *
 * <p>A feeder thread pushes paths into a bounded work queue (blocking when it is
 * full); workers pull paths, process them and push one result per path into a
 * bounded result queue. The consumer iterates results in completion order.
 * Every per-file failure becomes a failed {@link PipelineResult}, including
 * errors such as {@link OutOfMemoryError}; the batch carries on. Only a fatal
 * VM error ends a worker.</p>
 *
 * <p>Single use: iterate once, then {@link #close()}. Closing early cancels the
 * batch; workers stop pulling new paths and exit.</p>
 */
public final class HashingPipeline implements Iterator<PipelineResult>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HashingPipeline.class);

    private static final long POLL_MILLIS = 100;
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final List<Path> paths;
    private final ImageProcessor processor;
    private final int workers;
    private final BlockingQueue<Path> workQueue;
    private final BlockingQueue<Completed> resultQueue;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Future<?>> workerFutures = new ArrayList<>();
    private final ExecutorService pool;
    private volatile boolean doneFeeding;

    private int emitted;
    private boolean closed;

    private HashingPipeline(Collection<Path> paths, ImageProcessor processor, int workers, int queueCapacity) {
        this.paths = List.copyOf(paths);
        this.processor = processor;
        this.workers = workers;
        this.workQueue = new ArrayBlockingQueue<>(queueCapacity);
        this.resultQueue = new ArrayBlockingQueue<>(queueCapacity);
        this.pool = Executors.newFixedThreadPool(workers + 1, new WorkerThreadFactory());
    }

    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static HashingPipeline start(Collection<Path> paths, ImageProcessor processor, int workers) {
        int w = workers > 0 ? workers : defaultWorkers();
        return start(paths, processor, w, Math.max(4, w * 4));
    }

    public static HashingPipeline start(Collection<Path> paths, ImageProcessor processor, int workers, int queueCapacity) {
        if (workers < 1) throw new IllegalArgumentException("At least one worker is required, got " + workers);
        if (queueCapacity < 1) throw new IllegalArgumentException("Queue capacity must be positive, got " + queueCapacity);
        HashingPipeline pipeline = new HashingPipeline(paths, processor, workers, queueCapacity);
        pipeline.launch();
        return pipeline;
    }

    private void launch() {
        log.debug("Starting {} workers for {} images", workers, paths.size());
        pool.submit(this::feed);
        for (int i = 0; i < workers; i++) {
            workerFutures.add(pool.submit(this::work));
        }
    }

    public int total() {
        return paths.size();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public boolean hasNext() {
        return !closed && emitted < paths.size();
    }

    @Override
    public PipelineResult next() {
        if (!hasNext()) throw new NoSuchElementException();
        Completed c = awaitResult();
        emitted++;
        PipelineResult result = new PipelineResult(emitted, c.path, c.image, c.failure);
        if (!result.isSuccess()) logFailure(result);
        return result;
    }

    private Completed awaitResult() {
        try {
            while (true) {
                Completed c = resultQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (c != null) return c;
                if (cancelled.get()) throw new CancellationException("Image hashing was cancelled");
                if (allWorkersExited() && resultQueue.isEmpty()) {
                    throw new IllegalStateException("Workers exited after " + emitted + " of "
                            + paths.size() + " images; see the log for the cause");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new CancellationException("Interrupted while waiting for image hashes");
        }
    }

    private boolean allWorkersExited() {
        for (Future<?> f : workerFutures) {
            if (!f.isDone()) return false;
        }
        return true;
    }

    private void logFailure(PipelineResult result) {
        PipelineResult.Failure failure = result.failure();
        if (failure.kind() == PipelineResult.FailureKind.DECODE) {
            log.warn("Error hashing {}: {}", result.path(), failure.message());
        } else {
            log.error("Error hashing {}: {}", result.path(), failure.message(), failure.cause());
        }
    }

    // region Worker side

    private void feed() {
        try {
            for (Path path : paths) {
                while (!workQueue.offer(path, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (cancelled.get()) return;
                }
                if (cancelled.get()) return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        doneFeeding = true;
    }

    private void work() {
        log.debug("Worker starting with {}", processor.fingerprinter().settings().storeKey());
        try {
            while (!cancelled.get()) {
                Path path = workQueue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (path == null) {
                    if (doneFeeding && workQueue.isEmpty()) break;
                    continue;
                }
                Completed c = processOne(path);
                while (!resultQueue.offer(c, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (cancelled.get()) return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            log.error("Worker thread failed", e);
            throw e;
        } finally {
            log.debug("Worker finished");
        }
    }

    private Completed processOne(Path path) {
        try {
            return new Completed(path, processor.process(path), null);
        } catch (ImageDecodeException e) {
            return failed(path, PipelineResult.FailureKind.DECODE, e);
        } catch (IOException e) {
            return failed(path, PipelineResult.FailureKind.IO, e);
        } catch (RuntimeException e) {
            return failed(path, PipelineResult.FailureKind.UNEXPECTED, e);
        } catch (OutOfMemoryError | StackOverflowError e) {
            // one oversized or pathological file, the next one may well fit
            return failed(path, PipelineResult.FailureKind.UNEXPECTED, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            return failed(path, PipelineResult.FailureKind.UNEXPECTED, e);
        }
    }

    private static Completed failed(Path path, PipelineResult.FailureKind kind, Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new Completed(path, null, new PipelineResult.Failure(kind, message, e));
    }

    // endregion

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        cancelled.set(true);
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within {}s, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Completed(Path path, ProcessedImage image, PipelineResult.Failure failure) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQ = new AtomicInteger();
        private final int poolId = POOL_SEQ.incrementAndGet();
        private final AtomicInteger threadSeq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "image-hash-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
