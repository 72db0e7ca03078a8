package io.github.hotbrkm.inviteengine.agent.invite.send.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centrally manages all executors used by the engine.
 * <ul>
 *   <li><b>periodicExecutor</b> Periodic tasks (metrics eviction, daily reset tick). corePoolSize grows upon registration.</li>
 *   <li><b>workerExecutor</b> Fixed thread pool running recipient pipelines.</li>
 *   <li><b>completionExecutor</b> Cached pool for waiting on whole campaign runs.</li>
 * </ul>
 */
@Slf4j
final class EngineExecutors {

    private final ScheduledThreadPoolExecutor periodicExecutor;
    private final ThreadPoolExecutor workerExecutor;
    private final ExecutorService completionExecutor;

    EngineExecutors(int workerCount) {
        this.periodicExecutor = new ScheduledThreadPoolExecutor(0);
        this.periodicExecutor.setRemoveOnCancelPolicy(true);

        this.workerExecutor = (ThreadPoolExecutor) Executors.newFixedThreadPool(workerCount);
        this.completionExecutor = Executors.newCachedThreadPool();
    }

    /**
     * Registers a periodic task. Automatically increases corePoolSize.
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        int required = periodicExecutor.getCorePoolSize() + 1;
        periodicExecutor.setCorePoolSize(required);
        log.debug("Periodic executor corePoolSize increased to {}", required);
        return periodicExecutor.scheduleAtFixedRate(command, initialDelay, period, unit);
    }

    /**
     * Executor for recipient pipelines.
     */
    Executor workers() {
        return workerExecutor;
    }

    /**
     * Runs a blocking wait (a whole campaign run) off the worker pool so it cannot starve recipients.
     */
    <T> CompletableFuture<T> supplyOnCompletion(Supplier<T> supplier) {
        return CompletableFuture.supplyAsync(supplier, completionExecutor);
    }

    int activeWorkerCount() {
        return workerExecutor.getActiveCount();
    }

    int maxWorkerCount() {
        return workerExecutor.getMaximumPoolSize();
    }

    void shutdown() {
        periodicExecutor.shutdown();
        completionExecutor.shutdown();
        workerExecutor.shutdown();

        try {
            if (!completionExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                completionExecutor.shutdownNow();
            }
            if (!workerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
            if (!periodicExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                periodicExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            completionExecutor.shutdownNow();
            workerExecutor.shutdownNow();
            periodicExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
