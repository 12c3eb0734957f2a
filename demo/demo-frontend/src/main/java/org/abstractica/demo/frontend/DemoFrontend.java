package org.abstractica.demo.frontend;

import org.abstractica.frontend.FrontendSession;
import org.abstractica.frontend.SessionEvent;
import org.abstractica.frontend.SessionNotification;
import org.abstractica.frontend.SettingValue;
import org.abstractica.frontend.impl.loop.SingleThreadEventLoop;
import org.abstractica.frontend.impl.session.DefaultSessionService;
import org.abstractica.frontend.impl.session.DefaultSessionServiceFactory;
import org.abstractica.frontend.impl.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Demo frontend server.
 *
 * <p>Two connections log in as the same player, one of them stores its
 * lobby in the session settings, and the player is then kicked, which
 * closes both connections.</p>
 */
public class DemoFrontend
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoFrontend.class);
    private static final String PLAYER_UID = "player-42";

    public static void main(String[] args) throws InterruptedException
    {
        try (SingleThreadEventLoop loop = new SingleThreadEventLoop("demo-session-loop");
             DefaultSessionService service = new DefaultSessionServiceFactory().builder()
                     .frontendId("connector-1")
                     .eventLoop(loop)
                     .build())
        {
            CountDownLatch kicked = new CountDownLatch(1);

            loop.execute(() ->
            {
                Session desktop = service.create(1, new LoggingSocket("desktop", 40001));
                Session mobile = service.create(2, new LoggingSocket("mobile", 40002));

                FrontendSession handlerView = desktop.toFrontendSession();
                handlerView.on(SessionEvent.CLOSED, notification ->
                {
                    SessionNotification.Closed closed = (SessionNotification.Closed) notification;
                    LOG.info("Handler saw close of {}: {}", closed.session().export(), closed.reason());
                });

                handlerView.bind(PLAYER_UID, error ->
                {
                    if (error != null)
                    {
                        LOG.warn("Desktop login failed", error);
                        return;
                    }
                    handlerView.set("lobby", SettingValue.of("castle"));
                    handlerView.pushAll(pushError -> LOG.info("Desktop settings pushed: {}", desktop.getSettings()));

                    service.bind(mobile.getId(), PLAYER_UID, mobileError ->
                    {
                        LOG.info("Sessions of {}: {}", PLAYER_UID, service.getByUid(PLAYER_UID));
                        service.sendMessageByUid(PLAYER_UID, "welcome back");
                        service.kick(PLAYER_UID, "duplicate login", kickError ->
                        {
                            LOG.info("Kick done, {} session(s) left", service.getSessionsCount());
                            kicked.countDown();
                        });
                    });
                });
            });

            if (!kicked.await(5, TimeUnit.SECONDS))
            {
                LOG.warn("Demo did not finish in time");
            }
        }
    }
}
