package org.abstractica.frontend;

import org.abstractica.frontend.handlers.Callback;

import java.util.Map;
import java.util.Optional;

/**
 * Handler-facing view of a client session.
 *
 * <p>Application handlers never see the transport-side session. They get a
 * frontend session instead, which carries:</p>
 * <ul>
 *   <li>The session identity (session id, frontend id, bound user id)</li>
 *   <li>A point-in-time copy of the session settings</li>
 *   <li>Forwarders for the operations that must go through the session service</li>
 * </ul>
 *
 * <p>Changes made with {@link #set} stay local until they are pushed back
 * with {@link #push} or {@link #pushAll}. Changes made to the underlying
 * session after the view was taken are not reflected in it.</p>
 *
 * <p>Subscribing with {@link #on} also subscribes to the underlying session,
 * so notifications such as {@link SessionEvent#CLOSED} reach handler code
 * that only holds the frontend view.</p>
 */
public interface FrontendSession extends Notifiable
{
    /**
     * Returns the session id.
     *
     * @return session id
     */
    long getId();

    /**
     * Returns the id of the frontend server that owns the session.
     *
     * @return frontend id
     */
    String getFrontendId();

    /**
     * Returns the user id this view believes the session is bound to.
     *
     * <p>Updated only by this view's own {@link #bind} and {@link #unbind};
     * binds made through other views or directly on the session service are
     * not reflected.</p>
     *
     * @return the user id, or null if unbound
     */
    String getUid();

    /**
     * Binds the session to a user id through the session service.
     *
     * <p>On success the local user id is updated before the callback runs.</p>
     *
     * @param uid      the user id
     * @param callback receives the outcome (may be null)
     */
    void bind(String uid, Callback callback);

    /**
     * Unbinds the session from a user id through the session service.
     *
     * <p>On success the local user id is cleared before the callback runs.</p>
     *
     * @param uid      the user id the session is bound to
     * @param callback receives the outcome (may be null)
     */
    void unbind(String uid, Callback callback);

    /**
     * Sets a value in the local settings copy.
     *
     * @param key   the settings key
     * @param value the value
     */
    void set(String key, SettingValue value);

    /**
     * Reads a value from the local settings copy.
     *
     * @param key the settings key
     * @return the value, or empty if not set
     */
    Optional<SettingValue> get(String key);

    /**
     * Removes a value from the local settings copy.
     *
     * <p>Only settings are affected; identity fields cannot be removed.</p>
     *
     * @param key the settings key
     */
    void remove(String key);

    /**
     * Returns the local settings copy.
     *
     * @return unmodifiable view of the settings
     */
    Map<String, SettingValue> getSettings();

    /**
     * Pushes one local setting back into the session.
     *
     * <p>If the key is not set locally, it is cleared in the session.</p>
     *
     * @param key      the settings key
     * @param callback receives the outcome (may be null)
     */
    void push(String key, Callback callback);

    /**
     * Pushes all local settings back into the session.
     *
     * @param callback receives the outcome (may be null)
     */
    void pushAll(Callback callback);

    /**
     * Exports the serializable subset of this view.
     *
     * @return id, frontend id, user id and settings
     */
    ExportedSession export();
}
