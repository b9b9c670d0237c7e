package com.hartwig.alignpipe;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ThreadUtil {
    private ThreadUtil() {
    }

    /**
     * Grows up to the given number of threads and rejects work beyond that.
     */
    public static ExecutorService createExecutorService(int nMaxThreads, String nameTemplate) {
        return new ThreadPoolExecutor(1,
                nMaxThreads,
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
    }

    /**
     * Runs at most the given number of tasks at once and queues the rest.
     */
    public static ExecutorService createQueuedExecutorService(int nThreads, String nameTemplate) {
        return new ThreadPoolExecutor(nThreads,
                nThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
    }
}
