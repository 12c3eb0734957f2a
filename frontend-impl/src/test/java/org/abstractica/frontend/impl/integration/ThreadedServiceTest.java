package org.abstractica.frontend.impl.integration;

import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.impl.loop.SingleThreadEventLoop;
import org.abstractica.frontend.impl.session.DefaultSessionService;
import org.abstractica.frontend.impl.session.DefaultSessionServiceFactory;
import org.abstractica.frontend.impl.session.RecordingSocket;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service lifecycle and thread confinement on a real worker thread.
 */
class ThreadedServiceTest
{
    @Test
    void close_defaultBuiltService_stopsItsLoopThread() throws InterruptedException
    {
        DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                .frontendId("shutdown")
                .build();
        RecordingSocket socket = new RecordingSocket();
        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch ready = new CountDownLatch(1);

        service.getEventLoop().execute(() ->
        {
            worker.set(Thread.currentThread());
            service.create(1, socket);
            service.bind(1, "42", null);
            ready.countDown();
        });
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        assertEquals("session-loop-shutdown", worker.get().getName());

        service.close();
        worker.get().join(5000);

        assertFalse(worker.get().isAlive());
        assertEquals(List.of(new CloseReason.ServerShutdown()), socket.closingReasons);
        assertEquals(1, socket.disconnects);
    }

    @Test
    void close_injectedLoop_staysOpen() throws InterruptedException
    {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("caller-loop"))
        {
            DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                    .eventLoop(loop)
                    .build();

            service.close();

            CountDownLatch ran = new CountDownLatch(1);
            loop.execute(ran::countDown);
            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void callOffEventLoop_isRejected()
    {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("confined-loop"))
        {
            DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                    .eventLoop(loop)
                    .build();

            assertFalse(loop.inEventLoop());
            assertThrows(IllegalStateException.class, () -> service.create(1, new RecordingSocket()));
            assertThrows(IllegalStateException.class, () -> service.forEachSession(session -> { }));
            assertThrows(IllegalStateException.class, () -> service.bind(1, "42", null));
            assertThrows(IllegalStateException.class, () -> service.kick("42", null));
            assertThrows(IllegalStateException.class, () -> service.sendMessage(1, "hello"));
            assertThrows(IllegalStateException.class, service::getSessionsCount);
        }
    }
}
