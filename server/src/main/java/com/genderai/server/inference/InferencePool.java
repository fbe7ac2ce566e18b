package com.genderai.server.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers that run forward passes, in front of a bounded queue.
 * Work that finds both the workers and the queue full is refused at once.
 */
public class InferencePool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InferencePool.class);

    private final ThreadPoolExecutor executor;
    private final int poolSize;
    private final int queueDepth;

    public InferencePool(int poolSize, int queueDepth) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + poolSize);
        }
        if (queueDepth < 0) {
            throw new IllegalArgumentException("Queue depth must not be negative: " + queueDepth);
        }
        this.poolSize = poolSize;
        this.queueDepth = queueDepth;
        AtomicInteger counter = new AtomicInteger();
        BlockingQueue<Runnable> queue = queueDepth == 0
                ? new SynchronousQueue<Runnable>()
                : new ArrayBlockingQueue<Runnable>(queueDepth);
        this.executor = new ThreadPoolExecutor(
                poolSize, poolSize,
                0L, TimeUnit.MILLISECONDS,
                queue,
                r -> {
                    Thread t = new Thread(r, "inference-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        this.executor.prestartAllCoreThreads();
        logger.info("Inference pool started: workers={}, queueDepth={}", poolSize, queueDepth);
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    /**
     * @throws BusyException when no worker and no queue slot is free
     */
    public <T> Future<T> submit(Callable<T> task) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new BusyException("Inference pool saturated (" + poolSize + " workers, "
                    + queueDepth + " queued)", e);
        }
    }

    /**
     * Submits and waits up to {@code timeoutMillis}. On timeout the signal is
     * fired and a task still waiting in the queue is dropped; a running task is
     * not interrupted.
     */
    public <T> T call(Callable<T> task, long timeoutMillis, CancellationSignal signal)
            throws ExecutionException, TimeoutException, InterruptedException {
        Future<T> future = submit(task);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            signal.cancel();
            if (future.cancel(false) && future instanceof Runnable) {
                // a cancelled task keeps its queue slot until removed
                executor.remove((Runnable) future);
            }
            throw e;
        }
    }

    public int activeCount() {
        return executor.getActiveCount();
    }

    public int queuedCount() {
        return executor.getQueue().size();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
