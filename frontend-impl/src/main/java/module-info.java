/**
 * Frontend session implementation module.
 *
 * <p>Provides the default implementation of the frontend session API.</p>
 */
module frontend.impl
{
    requires frontend.api;
    requires org.slf4j;

    exports org.abstractica.frontend.impl.session;
    exports org.abstractica.frontend.impl.event;
    exports org.abstractica.frontend.impl.loop;
}
