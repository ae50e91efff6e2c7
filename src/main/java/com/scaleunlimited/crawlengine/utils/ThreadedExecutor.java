package com.scaleunlimited.crawlengine.utils;

import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of named daemon threads. Callers are expected to bound the
 * number of outstanding tasks themselves; the work queue is unbounded.
 */
public class ThreadedExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadedExecutor.class);

    private final ThreadPoolExecutor _pool;

    public ThreadedExecutor(final String name, int maxThreads) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + maxThreads);
        }

        ThreadFactory factory = new ThreadFactory() {
            private final AtomicInteger _threadIndex = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
                Thread result = new Thread(r, name + "-" + _threadIndex.incrementAndGet());
                result.setDaemon(true);
                return result;
            }
        };

        _pool = new ThreadPoolExecutor(maxThreads, maxThreads, 1L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(), factory);
    }

    public void execute(Runnable command) {
        _pool.execute(command);
    }

    public Future<?> submit(Runnable command) {
        return _pool.submit(command);
    }

    public int getActiveCount() {
        return _pool.getActiveCount();
    }

    public boolean isShutdown() {
        return _pool.isShutdown();
    }

    /**
     * Stop accepting work, wait up to <timeout> for running tasks, then
     * interrupt whatever is left.
     * 
     * @return true if everything finished without being interrupted.
     */
    public boolean terminate(long timeout, TimeUnit unit) throws InterruptedException {
        _pool.shutdown();
        if (_pool.awaitTermination(timeout, unit)) {
            return true;
        }

        List<Runnable> neverRan = _pool.shutdownNow();
        LOGGER.debug("Forced termination, {} queued tasks never ran", neverRan.size());
        return false;
    }

    /**
     * Interrupt running tasks and drop queued ones.
     */
    public void terminateNow() {
        _pool.shutdownNow();
    }
}
