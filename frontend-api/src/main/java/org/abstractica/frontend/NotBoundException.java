package org.abstractica.frontend;

/**
 * The session is not bound to the user id given to unbind.
 */
public class NotBoundException extends SessionException
{
    private static final long serialVersionUID = 1L;

    private final String uid;

    public NotBoundException(long sessionId, String uid)
    {
        super(sessionId, "session has not bound with " + uid);
        this.uid = uid;
    }

    /**
     * Returns the user id the caller tried to unbind.
     */
    public String getUid()
    {
        return uid;
    }
}
