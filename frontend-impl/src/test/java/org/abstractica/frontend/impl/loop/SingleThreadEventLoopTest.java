package org.abstractica.frontend.impl.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SingleThreadEventLoop}.
 */
class SingleThreadEventLoopTest
{
    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp()
    {
        loop = new SingleThreadEventLoop("test-loop");
    }

    @AfterEach
    void tearDown()
    {
        loop.close();
    }

    @Test
    void execute_runsTasksInOrderOnLoopThread() throws InterruptedException
    {
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicBoolean onLoop = new AtomicBoolean(false);
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> order.add(1));
        loop.execute(() -> order.add(2));
        loop.execute(() ->
        {
            onLoop.set(loop.inEventLoop());
            done.countDown();
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(1, 2), order);
        assertTrue(onLoop.get());
        assertFalse(loop.inEventLoop());
    }

    @Test
    void execute_failingTaskDoesNotStopLoop() throws InterruptedException
    {
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() ->
        {
            throw new IllegalStateException("boom");
        });
        loop.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void close_drainsQueuedTasks()
    {
        List<Integer> order = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 10; i++)
        {
            int n = i;
            loop.execute(() -> order.add(n));
        }

        loop.close();

        assertEquals(10, order.size());
    }
}
