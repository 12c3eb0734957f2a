package org.abstractica.frontend.impl.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Event loop backed by one daemon worker thread.
 *
 * <p>A task that throws is logged; the loop keeps running.</p>
 */
public class SingleThreadEventLoop implements EventLoop, AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(SingleThreadEventLoop.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final ExecutorService executor;
    private volatile Thread thread;

    /**
     * Creates an event loop.
     *
     * @param name name of the worker thread
     */
    public SingleThreadEventLoop(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread worker = new Thread(runnable, name);
            worker.setDaemon(true);
            thread = worker;
            return worker;
        });
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        executor.execute(() ->
        {
            try
            {
                task.run();
            }
            catch (RuntimeException e)
            {
                LOG.error("Task failed on event loop {}", name, e);
            }
        });
    }

    @Override
    public boolean inEventLoop()
    {
        return Thread.currentThread() == thread;
    }

    /**
     * Stops accepting tasks and waits for queued tasks to finish.
     *
     * <p>Called from the loop itself, queued tasks still run but the call
     * does not wait for them.</p>
     */
    @Override
    public void close()
    {
        executor.shutdown();
        if (inEventLoop())
        {
            LOG.debug("Event loop {} closing from its own thread", name);
            return;
        }
        try
        {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
            {
                LOG.warn("Event loop {} did not drain within {}", name, SHUTDOWN_TIMEOUT);
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e)
        {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("Event loop {} closed", name);
    }
}
