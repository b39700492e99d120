package com.babeltest.core.invoke;

import com.babeltest.core.resolve.Invocable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls resolved targets, optionally under a time budget.
 *
 * <p>Each call ends with exactly one of: the value, the target's own exception, or an
 * {@link InvocationTimeoutException}.
 * <ul>
 *   <li>Synchronous calls with a budget run on a dedicated daemon worker. A worker that
 *       overruns is abandoned, not stopped.</li>
 *   <li>Deferred results ({@link CompletionStage}, {@link Future}) are raced against this
 *       engine's timer; on expiry the pending future is cancelled.</li>
 *   <li>A deferred call requested from the timer thread itself, or from a
 *       {@link java.util.concurrent.ForkJoinPool} worker, is handed to an isolated worker
 *       that owns a private engine.</li>
 * </ul>
 */
public class InvocationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InvocationEngine.class);
    private static final AtomicInteger WORKERS = new AtomicInteger();

    private final ScheduledExecutorService timer;
    private volatile Thread timerThread;

    public InvocationEngine() {
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "babeltest-timer");
            thread.setDaemon(true);
            timerThread = thread;
            return thread;
        });
    }

    /**
     * Calls {@code callable} with {@code arguments}.
     *
     * @param timeoutMs budget in milliseconds; {@code null} or non-positive means wait indefinitely
     * @throws InvocationTimeoutException when the budget is exhausted
     * @throws Exception                  whatever the target raised
     */
    public Object invoke(Invocable callable, Map<String, Object> arguments, Integer timeoutMs) throws Exception {
        if (timeoutMs == null || timeoutMs <= 0) {
            return awaitUnbounded(callable.invoke(arguments));
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        if (callable.isAsync()) {
            if (insideScheduler()) {
                return invokeIsolated(callable, arguments, timeoutMs);
            }
            return await(callable.invoke(arguments), timeoutMs, deadline);
        }
        Object result = invokeOnWorker(callable, arguments, timeoutMs);
        return await(result, timeoutMs, deadline);
    }

    private Object invokeOnWorker(Invocable callable, Map<String, Object> arguments, int timeoutMs) throws Exception {
        FutureTask<Object> task = new FutureTask<>(() -> callable.invoke(arguments));
        Thread worker = daemon(task, "babeltest-invoke-" + WORKERS.incrementAndGet());
        worker.start();
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Worker {} exceeded {} ms and is left running", worker.getName(), timeoutMs);
            throw new InvocationTimeoutException(timeoutMs);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private Object await(Object result, int timeoutMs, long deadline) throws Exception {
        if (result instanceof CompletionStage<?> stage) {
            return race(stage.toCompletableFuture(), timeoutMs, deadline);
        }
        if (result instanceof Future<?> future) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                return future.get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new InvocationTimeoutException(timeoutMs);
            } catch (ExecutionException e) {
                throw unwrap(e);
            }
        }
        return result;
    }

    private Object race(CompletableFuture<?> pending, int timeoutMs, long deadline) throws Exception {
        CompletableFuture<Object> outcome = new CompletableFuture<>();
        pending.whenComplete((value, failure) -> {
            if (failure != null) {
                outcome.completeExceptionally(failure);
            } else {
                outcome.complete(value);
            }
        });
        long remaining = Math.max(0, deadline - System.nanoTime());
        ScheduledFuture<?> alarm = timer.schedule(() -> {
            if (outcome.completeExceptionally(new InvocationTimeoutException(timeoutMs))) {
                pending.cancel(true);
            }
        }, remaining, TimeUnit.NANOSECONDS);
        try {
            return outcome.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        } finally {
            alarm.cancel(false);
        }
    }

    private Object invokeIsolated(Invocable callable, Map<String, Object> arguments, int timeoutMs) throws Exception {
        ExecutorService isolated = Executors.newSingleThreadExecutor(isolatedThreads());
        try (InvocationEngine privateEngine = new InvocationEngine()) {
            Future<Object> call = isolated.submit(() -> privateEngine.invoke(callable, arguments, timeoutMs));
            return call.get();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } finally {
            isolated.shutdownNow();
        }
    }

    private static Object awaitUnbounded(Object result) throws Exception {
        try {
            if (result instanceof CompletionStage<?> stage) {
                return stage.toCompletableFuture().join();
            }
            if (result instanceof Future<?> future) {
                return future.get();
            }
            return result;
        } catch (CompletionException | ExecutionException e) {
            throw unwrap(e);
        }
    }

    boolean insideScheduler() {
        Thread current = Thread.currentThread();
        return current == timerThread || current instanceof ForkJoinWorkerThread;
    }

    static Exception unwrap(Throwable wrapper) {
        Throwable cause = wrapper;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause);
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    private static ThreadFactory isolatedThreads() {
        return runnable -> daemon(runnable, "babeltest-isolated-" + WORKERS.incrementAndGet());
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
