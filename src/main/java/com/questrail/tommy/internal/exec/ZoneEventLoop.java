package com.questrail.tommy.internal.exec;

import com.questrail.tommy.internal.time.SystemWallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ZoneEventLoop
 * =============================================================================
 * Production {@link ConsumerContext}: one dedicated thread draining an
 * unbounded task queue.
 *
 * <h2>Threading Model</h2>
 * Any thread may call {@link #execute(Runnable)}. Only the loop thread runs
 * tasks, one at a time, in submission order. This ensures:
 * <ul>
 *   <li>No concurrent modification of zone state</li>
 *   <li>Broker message order is preserved end to end</li>
 *   <li>A failing task cannot kill the loop</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()       → starts the loop thread
 *   loop.execute(...)  → enqueues a task
 *   loop.stop()        → stops the loop; pending tasks are discarded
 * </pre>
 * {@link #stop()} waits a bounded time for a running task. If the task outlives
 * that wait, {@code stop()} returns {@code false} and the caller must not touch
 * loop-confined state. An {@link Error} from a task is reported and ends the
 * loop.
 */
public final class ZoneEventLoop implements ConsumerContext {

    private static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final String threadName;
    private final long joinTimeoutMillis;
    private final ZoneObservabilitySink observabilitySink;

    private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread loopThread;

    public ZoneEventLoop(String threadName, ZoneObservabilitySink observabilitySink) {
        this(threadName, DEFAULT_JOIN_TIMEOUT, observabilitySink);
    }

    ZoneEventLoop(String threadName, Duration joinTimeout, ZoneObservabilitySink observabilitySink) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.joinTimeoutMillis = joinTimeout.toMillis();
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Starts the loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     *
     * @throws IllegalStateException if the thread of an earlier run is still busy
     */
    public void start() {
        Thread previous = loopThread;
        if (!running.get() && previous != null && previous.isAlive()) {
            throw new IllegalStateException("Loop thread " + threadName + " has not terminated yet");
        }
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, threadName);
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    /**
     * Stops the loop thread and waits for it to terminate. Idempotent.
     *
     * @return {@code true} if no loop thread is left running; {@code false} if
     *         a task was still executing when the wait timed out
     */
    public boolean stop() {
        Thread t = loopThread;
        if (running.compareAndSet(true, false)) {
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(joinTimeoutMillis);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            taskQueue.clear();
        }
        return t == null || t == Thread.currentThread() || !t.isAlive();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns true when called from the loop thread.
     */
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (running.get()) {
            taskQueue.offer(task);
        }
    }

    private void runLoop() {
        try {
            while (running.get()) {
                try {
                    Runnable task = taskQueue.take();
                    if (running.get()) {
                        task.run();
                    }
                } catch (InterruptedException e) {
                    // Expected during shutdown; a stray interrupt while running is ignored.
                } catch (Exception e) {
                    observabilitySink.onError(new ZoneErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Consumer task failed",
                        e
                    ));
                }
            }
        } catch (Error e) {
            running.set(false);
            taskQueue.clear();
            observabilitySink.onError(new ZoneErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Consumer thread " + threadName + " terminated",
                e
            ));
            throw e;
        }
    }
}
