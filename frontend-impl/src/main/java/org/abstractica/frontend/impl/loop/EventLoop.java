package org.abstractica.frontend.impl.loop;

/**
 * Single-consumer task queue that session state is confined to.
 *
 * <p>Tasks run one at a time, in submission order, and never before the
 * call that submitted them has returned. The session service uses it to
 * deliver asynchronous results and to defer socket teardown.</p>
 */
public interface EventLoop
{
    /**
     * Submits a task to run after the current task completes.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Returns whether the calling thread is the one that runs this loop's tasks.
     *
     * @return true if called from the loop
     */
    boolean inEventLoop();
}
