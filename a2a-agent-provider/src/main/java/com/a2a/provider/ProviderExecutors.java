package com.a2a.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide bounded pools. {@link #shared()} runs the blocking calls of {@link BlockingProvider}s
 * (threads {@code a2a-provider-N}); {@link #orchestration()} runs framework orchestration that waits
 * on providers (threads {@code a2a-orchestration-N}), kept apart so waiting orchestration never
 * starves the provider pool. Both are created lazily (lock-free CAS); sizes can be set before that.
 * Threads are daemons.
 */
public final class ProviderExecutors {

    private static final Logger log = LoggerFactory.getLogger(ProviderExecutors.class);

    public static final int DEFAULT_POOL_SIZE = 8;
    public static final int DEFAULT_ORCHESTRATION_POOL_SIZE = 4;

    private static final LazyPool PROVIDER = new LazyPool("a2a-provider", DEFAULT_POOL_SIZE);
    private static final LazyPool ORCHESTRATION = new LazyPool("a2a-orchestration", DEFAULT_ORCHESTRATION_POOL_SIZE);

    private ProviderExecutors() {
    }

    /**
     * Sets the size of the shared provider pool. Has no effect once the pool exists.
     */
    public static void configure(int size) {
        PROVIDER.configure(size);
    }

    /**
     * Sets the size of the orchestration pool. Has no effect once the pool exists.
     */
    public static void configureOrchestration(int size) {
        ORCHESTRATION.configure(size);
    }

    /** Returns the shared provider pool, creating it on first call. */
    public static ExecutorService shared() {
        return PROVIDER.get();
    }

    /** Returns the shared orchestration pool, creating it on first call. */
    public static ExecutorService orchestration() {
        return ORCHESTRATION.get();
    }

    /** Shuts both pools down; later calls start new ones. */
    public static void shutdown() {
        ORCHESTRATION.shutdown();
        PROVIDER.shutdown();
    }

    /** Fixed-size pool of daemon threads named {@code <prefix>-N}. */
    public static ExecutorService newPool(String prefix, int size) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(size, factory);
    }

    private static final class LazyPool {

        private final AtomicReference<ExecutorService> holder = new AtomicReference<>();
        private final String prefix;
        private volatile int size;

        LazyPool(String prefix, int size) {
            this.prefix = prefix;
            this.size = size;
        }

        void configure(int newSize) {
            if (newSize < 1) {
                throw new IllegalArgumentException("Pool size must be positive for " + prefix + ": " + newSize);
            }
            if (holder.get() != null) {
                log.warn("Pool {} already started; ignoring size {}", prefix, newSize);
                return;
            }
            size = newSize;
        }

        ExecutorService get() {
            ExecutorService existing = holder.get();
            if (existing != null && !existing.isShutdown()) {
                return existing;
            }
            ExecutorService created = newPool(prefix, size);
            if (holder.compareAndSet(existing, created)) {
                log.debug("Started pool {} with {} thread(s)", prefix, size);
                return created;
            }
            created.shutdown();
            return holder.get();
        }

        void shutdown() {
            ExecutorService existing = holder.getAndSet(null);
            if (existing != null) {
                existing.shutdown();
            }
        }
    }
}
