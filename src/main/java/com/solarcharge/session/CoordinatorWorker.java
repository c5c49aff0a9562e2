package com.solarcharge.session;

import com.solarcharge.config.CoordinatorConfig;
import com.solarcharge.exception.TransientIoException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Entry point onto the coordinator's single worker thread.
 *
 * <p>Telemetry callbacks use {@link #execute} (fire and forget); HTTP control requests use
 * {@link #call}, which blocks the request thread until the unit of work finishes and
 * rethrows its exception. Work submitted from the worker thread itself runs inline.
 */
@Component
public class CoordinatorWorker {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorWorker.class);

    private final ThreadPoolTaskScheduler scheduler;
    private final long callTimeoutMs;

    public CoordinatorWorker(
            @Qualifier("coordinatorScheduler") ThreadPoolTaskScheduler scheduler,
            @Value("${solarcharge.worker.call-timeout-ms:30000}") long callTimeoutMs) {
        this.scheduler = scheduler;
        this.callTimeoutMs = callTimeoutMs;
    }

    public void execute(Runnable task) {
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Coordinator task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Coordinator worker not accepting work, task dropped: {}", e.getMessage());
        }
    }

    public <T> T call(Callable<T> task) {
        if (isWorkerThread()) {
            return runInline(task);
        }
        Future<T> future;
        try {
            future = scheduler.submit(task);
        } catch (RejectedExecutionException e) {
            throw new TransientIoException("Coordinator is shutting down", e);
        }
        try {
            return future.get(callTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TransientIoException("Coordinator task failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientIoException("Coordinator did not complete the request in " + callTimeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIoException("Interrupted waiting for coordinator", e);
        }
    }

    public boolean isWorkerThread() {
        return Thread.currentThread().getName().startsWith(CoordinatorConfig.WORKER_THREAD_PREFIX);
    }

    /**
     * Waits for work queued so far to finish, then shuts the worker down. Timers must be
     * cancelled before this is called.
     */
    public void drain() {
        try {
            call(() -> null);
        } catch (RuntimeException e) {
            log.warn("Coordinator drain incomplete: {}", e.getMessage());
        }
        scheduler.shutdown();
        log.info("Coordinator worker drained and stopped");
    }

    private static <T> T runInline(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientIoException("Coordinator task failed: " + e.getMessage(), e);
        }
    }
}
