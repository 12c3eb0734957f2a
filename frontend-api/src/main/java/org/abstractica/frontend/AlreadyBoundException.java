package org.abstractica.frontend;

/**
 * The session is already bound to a different user id.
 */
public class AlreadyBoundException extends SessionException
{
    private static final long serialVersionUID = 1L;

    private final String boundUid;

    public AlreadyBoundException(long sessionId, String boundUid)
    {
        super(sessionId, "session has already bound with " + boundUid);
        this.boundUid = boundUid;
    }

    /**
     * Returns the user id the session is currently bound to.
     */
    public String getBoundUid()
    {
        return boundUid;
    }
}
