/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import ai.evacortex.p3if.core.FrameworkStore;
import ai.evacortex.p3if.core.config.FrameworkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool that runs independent multiplex jobs in parallel.
 *
 * <p>Jobs aimed at different stores proceed concurrently; jobs aimed at the same store are
 * serialized by that store's lock. Results come back in job order.</p>
 */
public class MultiplexBatchRunner implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(MultiplexBatchRunner.class);

    private final ExecutorService executor;

    public record Job(FrameworkStore target, ExternalFramework external) {}

    public MultiplexBatchRunner(FrameworkConfig config) {
        this(config.batchThreads());
    }

    public MultiplexBatchRunner(int threads) {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("p3if-multiplex-" + seq.incrementAndGet());
            return t;
        });
    }

    /**
     * Runs all jobs and waits for them.
     *
     * @throws IllegalStateException if a job fails outright (item-level failures are counted, not thrown)
     */
    public List<MultiplexResult> runAll(List<Job> jobs) throws InterruptedException {
        List<Callable<MultiplexResult>> tasks = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            tasks.add(() -> job.target().multiplexFrameworks(job.external()));
        }

        List<MultiplexResult> results = new ArrayList<>(jobs.size());
        for (Future<MultiplexResult> f : executor.invokeAll(tasks)) {
            try {
                results.add(f.get());
            } catch (ExecutionException e) {
                throw new IllegalStateException("Multiplex job failed", e.getCause());
            }
        }
        log.debug("Completed {} multiplex job(s)", results.size());
        return results;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
