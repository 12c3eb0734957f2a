package org.abstractica.frontend;

/**
 * Factory for creating SessionService instances.
 *
 * <p>Use the builder to configure the service before creation:</p>
 * <pre>{@code
 * SessionServiceFactory factory = new DefaultSessionServiceFactory();
 * SessionService service = factory.builder()
 *     .frontendId("connector-1")
 *     .singleSession(true)
 *     .build();
 * }</pre>
 */
public interface SessionServiceFactory
{
    /**
     * Creates a new service builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a SessionService.
     */
    interface Builder
    {
        /**
         * Sets whether a user id may have at most one bound session.
         *
         * <p>Optional. Defaults to false.</p>
         *
         * @param singleSession true to enable single-session mode
         * @return this builder
         */
        Builder singleSession(boolean singleSession);

        /**
         * Sets the id of the frontend server the sessions belong to.
         *
         * <p>Optional. Used for sessions created without an explicit
         * frontend id.</p>
         *
         * @param frontendId the frontend server id
         * @return this builder
         */
        Builder frontendId(String frontendId);

        /**
         * Builds the service.
         *
         * @return the configured service
         */
        SessionService build();
    }
}
