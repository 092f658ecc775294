package com.libragraph.squash.chksum.engine;

import com.libragraph.squash.chksum.api.ChecksumComputationFailedException;
import com.libragraph.squash.chksum.api.ChecksumResult;
import com.libragraph.squash.chksum.api.DigestDescriptor;
import com.libragraph.squash.chksum.api.UnsupportedDigestException;
import com.libragraph.squash.chksum.registry.DigestRegistry;
import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.CpuTopology;
import com.libragraph.squash.util.DigestValue;
import com.libragraph.squash.util.InvalidStateException;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes several digests over the same bytes, one worker per digest where that helps.
 *
 * <p>The parallel path is taken when more than one kind is requested, more than one
 * core is available and the source can be reopened. Each kind then gets its own
 * task reading the source through its own cursor, whatever its implementation
 * source. Everything else falls back to one sequential pass feeding every digester.
 *
 * <p>Either every digest is returned or a {@link ChecksumComputationFailedException}
 * is thrown; there are no partial results.
 */
public class ChecksumEngine implements AutoCloseable {

    private static final Logger log = Logger.getLogger(ChecksumEngine.class);

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private final DigestRegistry registry;
    private final int cores;
    private final int bufferSize;

    private ExecutorService pool;
    private boolean closed;

    public ChecksumEngine(DigestRegistry registry) {
        this(registry, CpuTopology.availableParallelism(), DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param cores      usable cores; the worker pool never grows beyond this
     * @param bufferSize read buffer per task
     */
    public ChecksumEngine(DigestRegistry registry, int cores, int bufferSize) {
        if (cores < 1) {
            throw new IllegalArgumentException("cores must be >= 1, got: " + cores);
        }
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1, got: " + bufferSize);
        }
        this.registry = registry;
        this.cores = cores;
        this.bufferSize = bufferSize;
    }

    public DigestRegistry registry() {
        return registry;
    }

    public int cores() {
        return cores;
    }

    public ChecksumResult compute(Path file, DigestKind... kinds) {
        if (kinds.length == 0) {
            throw new IllegalArgumentException("At least one digest kind is required");
        }
        return compute(ChecksumSource.of(file), EnumSet.copyOf(Arrays.asList(kinds)));
    }

    /**
     * @throws UnsupportedDigestException        before any read, if a kind has no implementation
     * @throws ChecksumComputationFailedException if reading or digesting fails
     */
    public ChecksumResult compute(ChecksumSource source, Set<DigestKind> kinds) {
        requireOpen();
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("At least one digest kind is required");
        }
        Map<DigestKind, DigestDescriptor> descriptors = registry.resolveAll(kinds);

        if (kinds.size() > 1 && cores > 1 && source.reopenable()) {
            List<DigestTask> tasks = plan(source, descriptors.values());
            log.debugf("Computing %s over %s with %d tasks", kinds, source, tasks.size());
            return new ChecksumResult(runParallel(tasks));
        }
        log.debugf("Computing %s over %s sequentially", kinds, source);
        return new ChecksumResult(new DigestTask(source, new ArrayList<>(descriptors.values()), bufferSize).call());
    }

    private List<DigestTask> plan(ChecksumSource source, Iterable<DigestDescriptor> descriptors) {
        List<DigestTask> tasks = new ArrayList<>();
        for (DigestDescriptor d : descriptors) {
            tasks.add(new DigestTask(source, List.of(d), bufferSize));
        }
        return tasks;
    }

    private Map<DigestKind, DigestValue> runParallel(List<DigestTask> tasks) {
        CompletionService<Map<DigestKind, DigestValue>> completion = new ExecutorCompletionService<>(pool());
        Map<Future<Map<DigestKind, DigestValue>>, DigestTask> running = new HashMap<>();
        for (DigestTask task : tasks) {
            running.put(completion.submit(task), task);
        }

        Map<DigestKind, DigestValue> values = new EnumMap<>(DigestKind.class);
        try {
            for (int i = 0; i < tasks.size(); i++) {
                Future<Map<DigestKind, DigestValue>> done = completion.take();
                try {
                    values.putAll(done.get());
                } catch (ExecutionException e) {
                    cancelAll(running.keySet());
                    throw failure(running.get(done), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancelAll(running.keySet());
            Thread.currentThread().interrupt();
            throw new ChecksumComputationFailedException(tasks.get(0).primaryKind(), e);
        }
        return values;
    }

    private static ChecksumComputationFailedException failure(DigestTask task, Throwable cause) {
        if (cause instanceof ChecksumComputationFailedException) {
            return (ChecksumComputationFailedException) cause;
        }
        return new ChecksumComputationFailedException(task.primaryKind(), cause);
    }

    private static void cancelAll(Iterable<Future<Map<DigestKind, DigestValue>>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    private synchronized void requireOpen() {
        if (closed) {
            throw new InvalidStateException("Checksum engine is closed");
        }
    }

    private synchronized ExecutorService pool() {
        requireOpen();
        if (pool == null) {
            AtomicInteger threadCounter = new AtomicInteger(0);
            ThreadFactory threadFactory = r -> {
                Thread t = new Thread(r, "chksum-worker-" + threadCounter.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
            pool = Executors.newFixedThreadPool(cores, threadFactory);
            log.debugf("Started checksum pool with %d workers", cores);
        }
        return pool;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (pool == null) {
            return;
        }
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warnf("Checksum workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
