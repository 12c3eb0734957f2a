package org.abstractica.frontend;

/**
 * Base class of the failures reported by session operations.
 *
 * <p>All of them are local and recoverable. They are delivered as values
 * through a {@link org.abstractica.frontend.handlers.Callback} and never
 * thrown out of a session service call.</p>
 */
public abstract class SessionException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final long sessionId;

    protected SessionException(long sessionId, String message)
    {
        super(message);
        this.sessionId = sessionId;
    }

    /**
     * Returns the id of the session the operation targeted.
     */
    public long getSessionId()
    {
        return sessionId;
    }
}
