package com.libragraph.squash.codecs.api;

/**
 * Caller's parallelism preference for a compression stream.
 *
 * <p>{@link #SERIAL} asks for a single-threaded backend, {@link #AUTO} for the
 * most capable parallel backend with one worker per physical core, and
 * {@link #workers(int)} for an explicit worker count. Whatever is requested,
 * the effective count never exceeds the detected core count.
 *
 * @param wantParallel     whether a parallel-capable backend should be preferred
 * @param requestedWorkers explicit worker count, or 0 for "one per core"
 */
public record Parallelism(boolean wantParallel, int requestedWorkers) {

    public static final Parallelism SERIAL = new Parallelism(false, 1);
    public static final Parallelism AUTO = new Parallelism(true, 0);

    public Parallelism {
        if (requestedWorkers < 0) {
            throw new IllegalArgumentException("Worker count must be >= 0, got: " + requestedWorkers);
        }
    }

    /**
     * Explicit worker count. One worker is the same as {@link #SERIAL}.
     */
    public static Parallelism workers(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Worker count must be >= 1, got: " + count);
        }
        return count == 1 ? SERIAL : new Parallelism(true, count);
    }

    public static Parallelism of(boolean parallel) {
        return parallel ? AUTO : SERIAL;
    }

    /**
     * Worker count to pass to a backend given {@code cores} usable cores.
     */
    public int effectiveWorkers(int cores) {
        int cap = Math.max(1, cores);
        if (!wantParallel) {
            return 1;
        }
        return requestedWorkers == 0 ? cap : Math.min(requestedWorkers, cap);
    }
}
