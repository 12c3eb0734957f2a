package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.FrontendSession;
import org.abstractica.frontend.Notifiable;
import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionNotification;
import org.abstractica.frontend.SettingValue;
import org.abstractica.frontend.Socket;
import org.abstractica.frontend.handlers.SessionListener;
import org.abstractica.frontend.impl.event.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Server-side record of one client connection.
 *
 * <p>Holds the session identity, the bound user id, a free-form settings
 * store and the socket it exclusively owns. Sessions are created by
 * {@link DefaultSessionService#create} and must not be handed to
 * application handlers; handlers get a {@link FrontendSession} from
 * {@link #toFrontendSession()} instead.</p>
 *
 * <p>Confined to the session service's event loop.</p>
 */
public class Session implements Notifiable
{
    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    private final long id;
    private final String frontendId;
    private final Socket socket;
    private final SessionCallback callback;
    private final NotificationDispatcher dispatcher;
    private final Map<String, SettingValue> settings;

    private String uid;
    private SessionState state;

    /**
     * Creates a new session.
     *
     * @param id         the session id
     * @param frontendId the owning frontend server
     * @param socket     the client socket
     * @param callback   callback to the session service
     */
    Session(long id, String frontendId, Socket socket, SessionCallback callback)
    {
        this.id = id;
        this.frontendId = Objects.requireNonNull(frontendId, "frontendId");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.dispatcher = new NotificationDispatcher();
        this.settings = new LinkedHashMap<>();
        this.uid = null;
        this.state = SessionState.INITIALIZED;
    }

    /**
     * Creates a handler-facing view of this session.
     *
     * <p>The view copies the current settings; later changes on either side
     * are independent until pushed.</p>
     *
     * @return a new frontend session
     */
    public FrontendSession toFrontendSession()
    {
        return new DefaultFrontendSession(this, callback.getSessionService());
    }

    // ========== Identity ==========

    /**
     * Records the user id and notifies {@link SessionEvent#BIND} listeners.
     *
     * <p>Performs no checks; the session service validates first.</p>
     */
    void bind(String uid)
    {
        this.uid = uid;
        dispatcher.emit(new SessionNotification.Bound(uid));
    }

    /**
     * Clears the user id and notifies {@link SessionEvent#UNBIND} listeners.
     *
     * <p>Performs no checks; the session service validates first.</p>
     */
    void unbind(String uid)
    {
        this.uid = null;
        dispatcher.emit(new SessionNotification.Unbound(uid));
    }

    public long getId()
    {
        return id;
    }

    public String getFrontendId()
    {
        return frontendId;
    }

    /**
     * Returns the bound user id, or null if unbound.
     */
    public String getUid()
    {
        return uid;
    }

    public SessionState getState()
    {
        return state;
    }

    public boolean isClosed()
    {
        return state == SessionState.CLOSED;
    }

    /**
     * Returns the client's address as reported by the socket.
     */
    public SocketAddress getRemoteAddress()
    {
        return socket.getRemoteAddress();
    }

    // ========== Settings ==========

    /**
     * Sets one value; a null value clears the key.
     *
     * @param key   the settings key
     * @param value the value (may be null)
     */
    public void set(String key, SettingValue value)
    {
        Objects.requireNonNull(key, "key");
        if (value == null)
        {
            settings.remove(key);
        }
        else
        {
            settings.put(key, value);
        }
    }

    /**
     * Merges every entry of a mapping into the settings.
     *
     * @param values the values to merge
     */
    public void set(Map<String, SettingValue> values)
    {
        Objects.requireNonNull(values, "values");
        values.forEach(this::set);
    }

    /**
     * Reads one value.
     *
     * @param key the settings key
     * @return the value, or empty if not set
     */
    public Optional<SettingValue> get(String key)
    {
        return Optional.ofNullable(settings.get(key));
    }

    /**
     * Removes one value from the settings.
     *
     * @param key the settings key
     */
    public void remove(String key)
    {
        settings.remove(key);
    }

    /**
     * Returns the settings.
     *
     * @return unmodifiable live view
     */
    public Map<String, SettingValue> getSettings()
    {
        return Collections.unmodifiableMap(settings);
    }

    // ========== Messaging ==========

    public void send(Object message)
    {
        socket.send(message);
    }

    public void sendBatch(List<?> messages)
    {
        socket.sendBatch(messages);
    }

    // ========== Notifications ==========

    @Override
    public void on(SessionEvent event, SessionListener listener)
    {
        dispatcher.subscribe(event, listener);
    }

    // ========== Lifecycle ==========

    /**
     * Closes the session.
     *
     * <p>The first call deregisters the session, notifies
     * {@link SessionEvent#CLOSED} listeners with a fresh frontend view, tells
     * the socket that closing has begun and schedules the disconnect on the
     * event loop, so listeners run before the socket is torn down. Later
     * calls do nothing. If a listener throws, the socket is still torn down
     * and the exception propagates.</p>
     *
     * @param reason why the session is closing
     */
    public void closed(CloseReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        LOG.debug("Session on [{}] is closed with session id: {}", frontendId, id);
        if (state == SessionState.CLOSED)
        {
            return;
        }
        state = SessionState.CLOSED;
        callback.onSessionClosed(this);
        try
        {
            dispatcher.emit(new SessionNotification.Closed(toFrontendSession(), reason));
        }
        finally
        {
            // Teardown runs even if a listener throws
            socket.notifyClosing(reason);
            callback.getEventLoop().execute(socket::disconnect);
        }
    }

    @Override
    public String toString()
    {
        return "Session{id=" + id + ", frontendId=" + frontendId + ", uid=" + uid + ", state=" + state + "}";
    }
}
