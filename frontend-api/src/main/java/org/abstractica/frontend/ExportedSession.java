package org.abstractica.frontend;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable subset of a session: identity and settings only.
 *
 * <p>Safe to hand across a process boundary or to write to logs; it holds
 * no reference to the socket or to the session service.</p>
 *
 * @param id         the session id
 * @param frontendId the frontend server that owns the session
 * @param uid        the bound user id, or null if the session is not bound
 * @param settings   the session settings
 */
public record ExportedSession(
        long id,
        String frontendId,
        String uid,
        Map<String, SettingValue> settings
) implements Serializable
{
    public ExportedSession
    {
        Objects.requireNonNull(frontendId, "frontendId");
        Objects.requireNonNull(settings, "settings");
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }
}
