package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.SessionService;
import org.abstractica.frontend.impl.loop.EventLoop;

/**
 * Callback interface from session to session service.
 *
 * <p>The session's only handle on its owner: it is used to deregister on
 * close, to defer work and to build frontend views. It never gives the
 * session ownership of the service's maps.</p>
 */
interface SessionCallback
{
    /**
     * Notifies that a session has closed and must be deregistered.
     *
     * @param session the closed session
     */
    void onSessionClosed(Session session);

    /**
     * Gets the event loop the session is confined to.
     *
     * @return the event loop
     */
    EventLoop getEventLoop();

    /**
     * Gets the service that frontend views forward identity operations to.
     *
     * @return the session service
     */
    SessionService getSessionService();
}
