package org.abstractica.frontend.handlers;

import org.abstractica.frontend.SessionNotification;

/**
 * Listens for session lifecycle notifications.
 *
 * <p>Listeners are invoked synchronously, in registration order, on the
 * thread that emitted the notification. An exception thrown by a listener
 * propagates to the code that triggered the notification.</p>
 */
@FunctionalInterface
public interface SessionListener
{
    /**
     * Handles a notification.
     *
     * @param notification the notification
     */
    void onNotification(SessionNotification notification);
}
