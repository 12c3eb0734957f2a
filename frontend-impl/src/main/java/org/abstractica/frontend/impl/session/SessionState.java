package org.abstractica.frontend.impl.session;

/**
 * State of a session.
 *
 * <p>Moves from {@link #INITIALIZED} to {@link #CLOSED} exactly once.</p>
 */
public enum SessionState
{
    /**
     * Session is registered and its socket is usable.
     */
    INITIALIZED,

    /**
     * Session has been closed and removed from the session service.
     */
    CLOSED
}
