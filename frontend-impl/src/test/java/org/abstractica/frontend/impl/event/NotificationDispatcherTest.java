package org.abstractica.frontend.impl.event;

import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionNotification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NotificationDispatcher}.
 */
class NotificationDispatcherTest
{
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp()
    {
        dispatcher = new NotificationDispatcher();
    }

    @Test
    void emit_deliversInRegistrationOrder()
    {
        List<String> calls = new ArrayList<>();
        dispatcher.subscribe(SessionEvent.BIND, n -> calls.add("first"));
        dispatcher.subscribe(SessionEvent.BIND, n -> calls.add("second"));

        dispatcher.emit(new SessionNotification.Bound("7"));

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void emit_onlyReachesListenersOfThatEvent()
    {
        List<SessionNotification> received = new ArrayList<>();
        dispatcher.subscribe(SessionEvent.UNBIND, received::add);

        dispatcher.emit(new SessionNotification.Bound("7"));
        dispatcher.emit(new SessionNotification.Unbound("7"));

        assertEquals(List.of(new SessionNotification.Unbound("7")), received);
    }

    @Test
    void emit_withoutListeners_doesNothing()
    {
        assertDoesNotThrow(() -> dispatcher.emit(new SessionNotification.Bound("7")));
        assertEquals(0, dispatcher.listenerCount(SessionEvent.BIND));
    }

    @Test
    void emit_listenerExceptionPropagatesAndStopsDelivery()
    {
        List<String> calls = new ArrayList<>();
        dispatcher.subscribe(SessionEvent.BIND, n ->
        {
            throw new IllegalStateException("boom");
        });
        dispatcher.subscribe(SessionEvent.BIND, n -> calls.add("second"));

        assertThrows(IllegalStateException.class,
                () -> dispatcher.emit(new SessionNotification.Bound("7")));
        assertTrue(calls.isEmpty());
    }

    @Test
    void emit_listenerAddedDuringEmit_isNotCalledThisTime()
    {
        List<String> calls = new ArrayList<>();
        dispatcher.subscribe(SessionEvent.BIND, n ->
        {
            calls.add("outer");
            dispatcher.subscribe(SessionEvent.BIND, inner -> calls.add("inner"));
        });

        dispatcher.emit(new SessionNotification.Bound("7"));

        assertEquals(List.of("outer"), calls);
        assertEquals(2, dispatcher.listenerCount(SessionEvent.BIND));
    }
}
