package org.abstractica.frontend.impl.event;

import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionNotification;
import org.abstractica.frontend.handlers.SessionListener;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps listeners per event and delivers notifications to them.
 *
 * <p>Owned by each notifying entity rather than inherited. Delivery is
 * synchronous and in registration order; a listener that throws stops
 * delivery and the exception reaches the caller of {@link #emit}.
 * Listeners added during an emission are not invoked by that emission.</p>
 */
public class NotificationDispatcher
{
    private final Map<SessionEvent, List<SessionListener>> listeners = new EnumMap<>(SessionEvent.class);

    /**
     * Subscribes a listener.
     *
     * @param event    the event
     * @param listener the listener
     */
    public void subscribe(SessionEvent event, SessionListener listener)
    {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(listener, "listener");
        listeners.computeIfAbsent(event, e -> new ArrayList<>()).add(listener);
    }

    /**
     * Delivers a notification to the listeners of its event.
     *
     * @param notification the notification
     */
    public void emit(SessionNotification notification)
    {
        Objects.requireNonNull(notification, "notification");
        List<SessionListener> subscribed = listeners.get(notification.event());
        if (subscribed == null)
        {
            return;
        }
        for (SessionListener listener : List.copyOf(subscribed))
        {
            listener.onNotification(notification);
        }
    }

    /**
     * Returns the number of subscriptions for an event.
     *
     * @param event the event
     * @return subscription count
     */
    public int listenerCount(SessionEvent event)
    {
        List<SessionListener> subscribed = listeners.get(event);
        return subscribed == null ? 0 : subscribed.size();
    }
}
