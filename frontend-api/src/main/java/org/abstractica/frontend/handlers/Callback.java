package org.abstractica.frontend.handlers;

import org.abstractica.frontend.SessionException;

/**
 * Receives the outcome of an asynchronous session operation.
 *
 * <p>Bind, unbind and kick results are always delivered from the session
 * service's event loop after the triggering call has returned, never from
 * within the call itself.</p>
 */
@FunctionalInterface
public interface Callback
{
    /**
     * A callback that ignores the outcome.
     */
    Callback NOOP = error -> {};

    /**
     * Called when the operation has completed.
     *
     * @param error the failure, or null if the operation succeeded
     */
    void onComplete(SessionException error);

    /**
     * Returns the given callback, or {@link #NOOP} if it is null.
     *
     * @param callback the callback supplied by a caller (may be null)
     * @return a non-null callback
     */
    static Callback orNoop(Callback callback)
    {
        return callback != null ? callback : NOOP;
    }
}
