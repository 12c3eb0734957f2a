package org.abstractica.frontend.impl.integration;

import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.FrontendSession;
import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionNotification;
import org.abstractica.frontend.impl.loop.ManualEventLoop;
import org.abstractica.frontend.impl.loop.SingleThreadEventLoop;
import org.abstractica.frontend.impl.session.DefaultSessionService;
import org.abstractica.frontend.impl.session.DefaultSessionServiceFactory;
import org.abstractica.frontend.impl.session.RecordingCallback;
import org.abstractica.frontend.impl.session.RecordingSocket;
import org.abstractica.frontend.impl.session.Session;
import org.abstractica.frontend.impl.session.SessionState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Login and kick flow across two connections of the same user.
 */
class KickScenarioTest
{
    @Test
    void twoSessionsOfOneUser_kickedTogether()
    {
        ManualEventLoop loop = new ManualEventLoop();
        DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                .frontendId("f1")
                .eventLoop(loop)
                .build();

        RecordingSocket socket1 = new RecordingSocket();
        RecordingSocket socket2 = new RecordingSocket();
        Session s1 = service.create(1, "f1", socket1);
        Session s2 = service.create(2, "f1", socket2);

        List<SessionNotification> closedSeenByHandler = new ArrayList<>();
        FrontendSession handlerView = s1.toFrontendSession();
        handlerView.on(SessionEvent.CLOSED, closedSeenByHandler::add);

        RecordingCallback bind1 = new RecordingCallback();
        RecordingCallback bind2 = new RecordingCallback();
        service.bind(1, "42", bind1);
        service.bind(2, "42", bind2);
        loop.runPending();

        assertTrue(bind1.succeeded());
        assertTrue(bind2.succeeded());
        assertEquals(2, service.getByUid("42").size());

        RecordingCallback kick = new RecordingCallback();
        service.kick("42", "admin", kick);
        loop.runPending();

        assertTrue(kick.succeeded());
        assertEquals(SessionState.CLOSED, s1.getState());
        assertEquals(SessionState.CLOSED, s2.getState());
        assertNull(service.getByUid("42"));
        assertNull(service.get(1));
        assertNull(service.get(2));
        assertEquals(0, service.getSessionsCount());
        assertEquals(1, socket1.disconnects);
        assertEquals(1, socket2.disconnects);

        assertEquals(1, closedSeenByHandler.size());
        SessionNotification.Closed closed = (SessionNotification.Closed) closedSeenByHandler.get(0);
        assertEquals(CloseReason.kicked("admin"), closed.reason());
        assertEquals("42", closed.session().getUid());
    }

    @Test
    void bindOnThreadedLoop_completesAfterCallReturns() throws InterruptedException
    {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("scenario-loop"))
        {
            DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                    .eventLoop(loop)
                    .singleSession(true)
                    .build();
            CountDownLatch done = new CountDownLatch(2);
            AtomicReference<Boolean> callReturnedFirst = new AtomicReference<>();
            AtomicReference<Exception> secondError = new AtomicReference<>();

            loop.execute(() ->
            {
                service.create(1, new RecordingSocket());
                service.create(2, new RecordingSocket());
                boolean[] returned = {false};
                service.bind(1, "42", error ->
                {
                    callReturnedFirst.set(returned[0]);
                    done.countDown();
                });
                returned[0] = true;
                service.bind(2, "42", error ->
                {
                    secondError.set(error);
                    done.countDown();
                });
            });

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(callReturnedFirst.get());
            assertNotNull(secondError.get());
        }
    }
}
