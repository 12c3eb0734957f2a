package org.abstractica.frontend;

import java.io.IOException;
import java.util.Objects;

/**
 * Reason for closing a session.
 *
 * <p>Sealed interface enabling exhaustive handling of close causes.</p>
 */
public sealed interface CloseReason
{
    /**
     * Message used when a session is kicked without an explicit reason.
     */
    String DEFAULT_KICK_MESSAGE = "kick";

    /**
     * The session was kicked by an administrative action.
     *
     * @param message reason given by the kicking code
     */
    record Kicked(String message) implements CloseReason
    {
        public Kicked
        {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * The transport reported an error on the connection.
     *
     * @param cause the underlying I/O exception
     */
    record TransportError(IOException cause) implements CloseReason {}

    /**
     * The client closed the connection.
     */
    record ClientDisconnect() implements CloseReason {}

    /**
     * The frontend server is shutting down.
     */
    record ServerShutdown() implements CloseReason {}

    /**
     * Creates a kick reason.
     *
     * @param message the reason message, or null for the default
     * @return the reason
     */
    static CloseReason kicked(String message)
    {
        return new Kicked(message != null ? message : DEFAULT_KICK_MESSAGE);
    }
}
