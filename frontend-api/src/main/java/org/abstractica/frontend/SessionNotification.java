package org.abstractica.frontend;

import java.util.Objects;

/**
 * Payload of a session notification.
 *
 * <p>Sealed interface so listeners can branch exhaustively on the kind of
 * notification they received.</p>
 */
public sealed interface SessionNotification
{
    /**
     * Returns the event this notification is emitted under.
     *
     * @return the event
     */
    SessionEvent event();

    /**
     * The session was bound to a user id.
     *
     * @param uid the user id
     */
    record Bound(String uid) implements SessionNotification
    {
        public Bound
        {
            Objects.requireNonNull(uid, "uid");
        }

        @Override
        public SessionEvent event()
        {
            return SessionEvent.BIND;
        }
    }

    /**
     * The session was unbound from a user id.
     *
     * @param uid the user id the session was bound to
     */
    record Unbound(String uid) implements SessionNotification
    {
        public Unbound
        {
            Objects.requireNonNull(uid, "uid");
        }

        @Override
        public SessionEvent event()
        {
            return SessionEvent.UNBIND;
        }
    }

    /**
     * The session was closed.
     *
     * @param session snapshot of the session taken at closing time
     * @param reason  why the session was closed
     */
    record Closed(FrontendSession session, CloseReason reason) implements SessionNotification
    {
        public Closed
        {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public SessionEvent event()
        {
            return SessionEvent.CLOSED;
        }
    }
}
