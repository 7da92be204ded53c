package com.questrail.tommy.internal.exec;

import com.questrail.tommy.observability.RecordingObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ZoneEventLoopTest
 * -----------------------------------------------------------------------------
 * Serialized execution, failure containment, and shutdown of the consumer loop.
 */
class ZoneEventLoopTest {

    private RecordingObservabilitySink sink;
    private ZoneEventLoop loop;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        loop = new ZoneEventLoop("zone-loop-test", sink);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    @Test
    void runsTasksInSubmissionOrderOnOneThread() throws InterruptedException {
        loop.start();

        List<Integer> order = new ArrayList<>();
        List<String> threads = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(100);

        for (int i = 0; i < 100; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
                done.countDown();
            });
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < 100; i++) {
            assertEquals(i, order.get(i));
        }
        assertTrue(threads.stream().allMatch("zone-loop-test"::equals));
    }

    @Test
    void failingTaskIsReportedAndLoopContinues() throws InterruptedException {
        loop.start();
        CountDownLatch after = new CountDownLatch(1);

        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(after::countDown);

        assertTrue(after.await(2, TimeUnit.SECONDS));
        List<ZoneErrorEvent> errors = sink.errors();
        assertEquals(1, errors.size());
        assertEquals("Consumer task failed", errors.get(0).message());
        assertEquals("boom", errors.get(0).cause().getMessage());
    }

    @Test
    void tasksSubmittedBeforeStartOrAfterStopAreDiscarded() throws InterruptedException {
        AtomicInteger ran = new AtomicInteger();
        loop.execute(ran::incrementAndGet);

        loop.start();
        CountDownLatch marker = new CountDownLatch(1);
        loop.execute(marker::countDown);
        assertTrue(marker.await(2, TimeUnit.SECONDS));

        loop.stop();
        loop.execute(ran::incrementAndGet);

        assertEquals(0, ran.get());
        assertFalse(loop.isRunning());
    }

    @Test
    void inEventLoopIsTrueOnlyOnLoopThread() throws InterruptedException {
        loop.start();
        AtomicBoolean inside = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            inside.set(loop.inEventLoop());
            done.countDown();
        });

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertTrue(inside.get());
        assertFalse(loop.inEventLoop());
    }

    @Test
    void startAndStopAreIdempotent() {
        loop.start();
        loop.start();
        assertTrue(loop.isRunning());

        loop.stop();
        loop.stop();
        assertFalse(loop.isRunning());
    }

    @Test
    void stopReportsTaskThatOutlivesTheJoinTimeout() throws InterruptedException {
        ZoneEventLoop slow = new ZoneEventLoop("zone-loop-slow", Duration.ofMillis(100), sink);
        slow.start();
        AtomicBoolean release = new AtomicBoolean();
        CountDownLatch entered = new CountDownLatch(1);

        slow.execute(() -> {
            entered.countDown();
            // Ignores interrupts until released.
            while (!release.get()) {
                Thread.onSpinWait();
            }
        });
        assertTrue(entered.await(2, TimeUnit.SECONDS));

        assertFalse(slow.stop());
        assertThrows(IllegalStateException.class, slow::start);

        release.set(true);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!slow.stop() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(slow.stop());
    }

    @Test
    void stopReturnsTrueWhenNeverStarted() {
        assertTrue(loop.stop());
    }

    @Test
    void errorFromTaskIsReportedAndEndsTheLoop() throws InterruptedException {
        loop.start();
        AssertionError fatal = new AssertionError("fatal");

        loop.execute(() -> {
            throw fatal;
        });

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (sink.errors().isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        List<ZoneErrorEvent> errors = sink.errors();
        assertEquals(1, errors.size());
        assertEquals("Consumer thread zone-loop-test terminated", errors.get(0).message());
        assertSame(fatal, errors.get(0).cause());
        assertFalse(loop.isRunning());
    }
}
