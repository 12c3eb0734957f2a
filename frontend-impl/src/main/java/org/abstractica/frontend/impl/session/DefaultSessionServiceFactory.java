package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.SessionServiceFactory;
import org.abstractica.frontend.impl.loop.EventLoop;
import org.abstractica.frontend.impl.loop.SingleThreadEventLoop;

import java.util.Objects;

/**
 * Default implementation of SessionServiceFactory.
 *
 * <p>Creates DefaultSessionService instances using a builder pattern.</p>
 */
public class DefaultSessionServiceFactory implements SessionServiceFactory
{
    /**
     * Frontend id used when none is configured.
     */
    public static final String DEFAULT_FRONTEND_ID = "frontend-server";

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private boolean singleSession = false;
        private String frontendId = DEFAULT_FRONTEND_ID;
        private EventLoop eventLoop; // Optional, a SingleThreadEventLoop is created if unset

        @Override
        public DefaultBuilder singleSession(boolean singleSession)
        {
            this.singleSession = singleSession;
            return this;
        }

        @Override
        public DefaultBuilder frontendId(String frontendId)
        {
            Objects.requireNonNull(frontendId, "frontendId");
            if (frontendId.isBlank())
            {
                throw new IllegalArgumentException("frontendId must not be blank");
            }
            this.frontendId = frontendId;
            return this;
        }

        /**
         * Sets the event loop the service is confined to.
         *
         * <p>If not set, a {@link SingleThreadEventLoop} named after the
         * frontend id is created and closed with the service. A loop set here
         * stays open when the service closes.</p>
         *
         * @param eventLoop the event loop
         * @return this builder
         */
        public DefaultBuilder eventLoop(EventLoop eventLoop)
        {
            this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
            return this;
        }

        @Override
        public DefaultSessionService build()
        {
            if (eventLoop != null)
            {
                return new DefaultSessionService(eventLoop, singleSession, frontendId);
            }
            // Created here, so the service closes it
            SingleThreadEventLoop loop = new SingleThreadEventLoop("session-loop-" + frontendId);
            return new DefaultSessionService(loop, singleSession, frontendId, loop);
        }
    }
}
