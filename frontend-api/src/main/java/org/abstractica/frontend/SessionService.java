package org.abstractica.frontend;

import org.abstractica.frontend.handlers.Callback;

import java.net.SocketAddress;
import java.util.Map;

/**
 * Registry of the live client sessions on one frontend server.
 *
 * <p>Maps session ids to sessions and user ids to the sessions bound to
 * them. The service is the only component that mutates either mapping.</p>
 *
 * <p>Bind, unbind and kick report their outcome asynchronously: the callback
 * runs on the service's event loop after the call has returned, even when
 * the outcome was known immediately. Settings imports report synchronously.</p>
 *
 * <p>Not thread-safe. All calls must be made from the service's event loop;
 * a call from any other thread is rejected with
 * {@link IllegalStateException}. {@link #close()} is the exception and may
 * be called from any thread.</p>
 */
public interface SessionService extends AutoCloseable
{
    /**
     * Returns whether a user id may have at most one bound session.
     *
     * @return true if single-session mode is enabled
     */
    boolean isSingleSession();

    /**
     * Binds a session to a user id.
     *
     * <p>Fails with {@link SessionNotFoundException} for an unknown session,
     * {@link AlreadyBoundException} if the session is bound to another user
     * id, and {@link SingleSessionViolationException} if single-session mode
     * is enabled and the user id already has a bound session. Binding a
     * session to the user id it is already bound to succeeds without
     * changes.</p>
     *
     * @param sid      the session id
     * @param uid      the user id
     * @param callback receives the outcome (may be null)
     */
    void bind(long sid, String uid, Callback callback);

    /**
     * Unbinds a session from a user id.
     *
     * <p>Fails with {@link SessionNotFoundException} for an unknown session
     * and {@link NotBoundException} if the session is not bound to the given
     * user id.</p>
     *
     * @param sid      the session id
     * @param uid      the user id the session is bound to
     * @param callback receives the outcome (may be null)
     */
    void unbind(long sid, String uid, Callback callback);

    /**
     * Writes one value into a session's settings.
     *
     * <p>A null value clears the key. Reports synchronously: the callback
     * has run when this method returns.</p>
     *
     * @param sid      the session id
     * @param key      the settings key
     * @param value    the value (may be null)
     * @param callback receives the outcome (may be null)
     */
    void importSetting(long sid, String key, SettingValue value, Callback callback);

    /**
     * Merges a mapping into a session's settings.
     *
     * <p>Reports synchronously: the callback has run when this method returns.</p>
     *
     * @param sid      the session id
     * @param settings the values to merge
     * @param callback receives the outcome (may be null)
     */
    void importAll(long sid, Map<String, SettingValue> settings, Callback callback);

    /**
     * Closes every session bound to a user id with the default kick reason.
     *
     * @param uid      the user id
     * @param callback receives the outcome (may be null)
     */
    void kick(String uid, Callback callback);

    /**
     * Closes every session bound to a user id.
     *
     * <p>Always succeeds; a user id without sessions is a no-op.</p>
     *
     * @param uid      the user id
     * @param reason   the kick reason sent to the client
     * @param callback receives the outcome (may be null)
     */
    void kick(String uid, String reason, Callback callback);

    /**
     * Closes one session with the default kick reason.
     *
     * @param sid      the session id
     * @param callback receives the outcome (may be null)
     */
    void kickBySessionId(long sid, Callback callback);

    /**
     * Closes one session if it exists.
     *
     * <p>Always succeeds; an unknown session id is a no-op.</p>
     *
     * @param sid      the session id
     * @param reason   the kick reason sent to the client
     * @param callback receives the outcome (may be null)
     */
    void kickBySessionId(long sid, String reason, Callback callback);

    /**
     * Returns the remote address of a session's client.
     *
     * @param sid the session id
     * @return the address, or null if the session is unknown
     */
    SocketAddress getClientAddressBySessionId(long sid);

    /**
     * Sends a message to the client of one session.
     *
     * @param sid     the session id
     * @param message the message
     * @return true if the session exists and the message was handed to its socket
     */
    boolean sendMessage(long sid, Object message);

    /**
     * Sends a message to every session bound to a user id.
     *
     * @param uid     the user id
     * @param message the message
     * @return true if at least one session is bound to the user id
     */
    boolean sendMessageByUid(String uid, Object message);

    /**
     * Returns the number of registered sessions.
     *
     * @return session count
     */
    int getSessionsCount();

    /**
     * Shuts the service down.
     *
     * <p>Closes every registered session with
     * {@link CloseReason.ServerShutdown} and releases the event loop if the
     * service created it. Later calls do nothing.</p>
     */
    @Override
    void close();
}
