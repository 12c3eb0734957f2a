package org.abstractica.frontend;

/**
 * Names of the notifications a session emits.
 */
public enum SessionEvent
{
    /**
     * The session was bound to a user id.
     */
    BIND,

    /**
     * The session was unbound from its user id.
     */
    UNBIND,

    /**
     * The session was closed and removed from the session service.
     */
    CLOSED
}
