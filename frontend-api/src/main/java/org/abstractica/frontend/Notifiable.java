package org.abstractica.frontend;

import org.abstractica.frontend.handlers.SessionListener;

/**
 * Something that emits session notifications to subscribed listeners.
 */
public interface Notifiable
{
    /**
     * Subscribes a listener to an event.
     *
     * <p>The same listener may be subscribed more than once and is then
     * invoked once per subscription.</p>
     *
     * @param event    the event to listen for
     * @param listener the listener to invoke
     */
    void on(SessionEvent event, SessionListener listener);
}
