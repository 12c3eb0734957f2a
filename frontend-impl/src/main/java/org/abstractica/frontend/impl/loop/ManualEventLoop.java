package org.abstractica.frontend.impl.loop;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Event loop driven by its owner.
 *
 * <p>Tasks queue up until {@link #runPending()} is called, and then run on
 * the calling thread. Useful for embedding the session service in an
 * existing loop and for deterministic tests.</p>
 */
public class ManualEventLoop implements EventLoop
{
    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public void execute(Runnable task)
    {
        tasks.addLast(Objects.requireNonNull(task, "task"));
    }

    /**
     * Always true: whoever drives the loop is the loop.
     */
    @Override
    public boolean inEventLoop()
    {
        return true;
    }

    /**
     * Runs queued tasks until the queue is empty.
     *
     * <p>Tasks submitted while draining run in the same call. An exception
     * thrown by a task propagates; the remaining tasks stay queued.</p>
     *
     * @return number of tasks run
     */
    public int runPending()
    {
        int count = 0;
        Runnable task;
        while ((task = tasks.pollFirst()) != null)
        {
            task.run();
            count++;
        }
        return count;
    }

    /**
     * Returns the number of queued tasks.
     */
    public int pendingCount()
    {
        return tasks.size();
    }
}
