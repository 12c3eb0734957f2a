/**
 * Frontend session API module.
 *
 * <p>Provides the handler-facing view of client sessions on a frontend
 * server: identity binding, per-connection settings and lifecycle
 * notifications.</p>
 */
module frontend.api
{
    exports org.abstractica.frontend;
    exports org.abstractica.frontend.handlers;
}
