package org.abstractica.frontend;

/**
 * The session id is not registered with the session service.
 */
public class SessionNotFoundException extends SessionException
{
    private static final long serialVersionUID = 1L;

    public SessionNotFoundException(long sessionId)
    {
        super(sessionId, "session does not exist, sid: " + sessionId);
    }
}
