package org.abstractica.frontend;

/**
 * Single-session mode is enabled and the user id already has a bound session.
 */
public class SingleSessionViolationException extends SessionException
{
    private static final long serialVersionUID = 1L;

    private final String uid;

    public SingleSessionViolationException(long sessionId, String uid)
    {
        super(sessionId, "singleSession is enabled, and session has already bound with uid: " + uid);
        this.uid = uid;
    }

    public String getUid()
    {
        return uid;
    }
}
