package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.ExportedSession;
import org.abstractica.frontend.FrontendSession;
import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionService;
import org.abstractica.frontend.SettingValue;
import org.abstractica.frontend.handlers.Callback;
import org.abstractica.frontend.handlers.SessionListener;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the FrontendSession interface.
 *
 * <p>Copies the identity of its session and takes a snapshot of its
 * settings at construction time.</p>
 */
public class DefaultFrontendSession implements FrontendSession
{
    private final long id;
    private final String frontendId;
    private final Map<String, SettingValue> settings;
    private final Session session;
    private final SessionService sessionService;

    private String uid;

    DefaultFrontendSession(Session session, SessionService sessionService)
    {
        this.session = Objects.requireNonNull(session, "session");
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService");
        this.id = session.getId();
        this.frontendId = session.getFrontendId();
        this.uid = session.getUid();
        // Values are immutable, so copying the map is a deep copy
        this.settings = new LinkedHashMap<>(session.getSettings());
    }

    @Override
    public long getId()
    {
        return id;
    }

    @Override
    public String getFrontendId()
    {
        return frontendId;
    }

    @Override
    public String getUid()
    {
        return uid;
    }

    @Override
    public void bind(String uid, Callback callback)
    {
        Callback cb = Callback.orNoop(callback);
        sessionService.bind(id, uid, error ->
        {
            if (error == null)
            {
                this.uid = uid;
            }
            cb.onComplete(error);
        });
    }

    @Override
    public void unbind(String uid, Callback callback)
    {
        Callback cb = Callback.orNoop(callback);
        sessionService.unbind(id, uid, error ->
        {
            if (error == null)
            {
                this.uid = null;
            }
            cb.onComplete(error);
        });
    }

    @Override
    public void set(String key, SettingValue value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        settings.put(key, value);
    }

    @Override
    public Optional<SettingValue> get(String key)
    {
        return Optional.ofNullable(settings.get(key));
    }

    @Override
    public void remove(String key)
    {
        settings.remove(key);
    }

    @Override
    public Map<String, SettingValue> getSettings()
    {
        return Collections.unmodifiableMap(settings);
    }

    @Override
    public void push(String key, Callback callback)
    {
        Objects.requireNonNull(key, "key");
        sessionService.importSetting(id, key, settings.get(key), callback);
    }

    @Override
    public void pushAll(Callback callback)
    {
        sessionService.importAll(id, settings, callback);
    }

    /**
     * Subscribes on the underlying session, which emits for every view of it.
     */
    @Override
    public void on(SessionEvent event, SessionListener listener)
    {
        session.on(event, listener);
    }

    @Override
    public ExportedSession export()
    {
        return new ExportedSession(id, frontendId, uid, settings);
    }

    @Override
    public String toString()
    {
        return "FrontendSession{id=" + id + ", frontendId=" + frontendId + ", uid=" + uid + "}";
    }
}
