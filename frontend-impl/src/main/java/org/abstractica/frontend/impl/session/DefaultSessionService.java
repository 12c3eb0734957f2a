package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.AlreadyBoundException;
import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.NotBoundException;
import org.abstractica.frontend.SessionException;
import org.abstractica.frontend.SessionNotFoundException;
import org.abstractica.frontend.SessionService;
import org.abstractica.frontend.SettingValue;
import org.abstractica.frontend.SingleSessionViolationException;
import org.abstractica.frontend.Socket;
import org.abstractica.frontend.handlers.Callback;
import org.abstractica.frontend.impl.loop.EventLoop;
import org.abstractica.frontend.impl.loop.SingleThreadEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Default implementation of the SessionService interface.
 *
 * <p>Maintains the session table and the user id index:</p>
 * <ul>
 *   <li>Every registered session with a user id appears exactly once in
 *       that user id's bucket</li>
 *   <li>Every session in a bucket is registered and bound to the bucket's
 *       user id</li>
 *   <li>A bucket that becomes empty is removed</li>
 * </ul>
 *
 * <p>Confined to its event loop and takes no locks. Every operation except
 * {@link #close()} and the configuration getters checks that it runs on the
 * event loop. Asynchronous results are submitted to the event loop, so they
 * are observed only after the triggering call has returned.</p>
 */
public class DefaultSessionService implements SessionService, SessionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSessionService.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final EventLoop eventLoop;
    private final SingleThreadEventLoop ownedEventLoop;
    private final boolean singleSession;
    private final String frontendId;

    private final Map<Long, Session> sessions;
    private final Map<String, List<Session>> uidMap;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a new session service on a caller-owned event loop.
     *
     * <p>Use {@link DefaultSessionServiceFactory} to create instances.</p>
     */
    DefaultSessionService(EventLoop eventLoop, boolean singleSession, String frontendId)
    {
        this(eventLoop, singleSession, frontendId, null);
    }

    /**
     * Creates a new session service.
     *
     * @param ownedEventLoop the loop to close with the service, or null if
     *                       the caller owns {@code eventLoop}
     */
    DefaultSessionService(EventLoop eventLoop, boolean singleSession, String frontendId,
                          SingleThreadEventLoop ownedEventLoop)
    {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.frontendId = Objects.requireNonNull(frontendId, "frontendId");
        this.singleSession = singleSession;
        this.ownedEventLoop = ownedEventLoop;

        this.sessions = new LinkedHashMap<>();
        this.uidMap = new LinkedHashMap<>();
    }

    // ========== Registration ==========

    /**
     * Creates and registers a session for a new connection.
     *
     * <p>The caller guarantees that {@code sid} is not in use. A duplicate
     * id replaces the registered session without closing it.</p>
     *
     * @param sid        the session id
     * @param frontendId the frontend server the session belongs to
     * @param socket     the client socket
     * @return the new session
     */
    public Session create(long sid, String frontendId, Socket socket)
    {
        checkInEventLoop();
        Session session = new Session(sid, frontendId, socket, this);
        Session previous = sessions.put(sid, session);
        if (previous != null)
        {
            LOG.warn("Session id {} was already registered, replacing {}", sid, previous);
        }
        LOG.debug("Session created: sid={}, frontendId={}, address={}",
                sid, frontendId, socket.getRemoteAddress());
        return session;
    }

    /**
     * Creates and registers a session on this service's frontend server.
     *
     * @param sid    the session id
     * @param socket the client socket
     * @return the new session
     */
    public Session create(long sid, Socket socket)
    {
        return create(sid, frontendId, socket);
    }

    /**
     * Deregisters a session from the session table and its user id bucket.
     *
     * <p>Does nothing for an unknown session id.</p>
     *
     * @param sid the session id
     */
    public void remove(long sid)
    {
        checkInEventLoop();
        Session session = sessions.remove(sid);
        if (session == null)
        {
            return;
        }
        String uid = session.getUid();
        if (uid != null)
        {
            removeFromBucket(uid, session);
        }
        LOG.debug("Session removed: sid={}, uid={}", sid, uid);
    }

    /**
     * Finds a session by id.
     *
     * @param sid the session id
     * @return the session, or null if not registered
     */
    public Session get(long sid)
    {
        checkInEventLoop();
        return sessions.get(sid);
    }

    /**
     * Finds the sessions bound to a user id.
     *
     * @param uid the user id
     * @return snapshot of the bound sessions in binding order, or null if none is bound
     */
    public List<Session> getByUid(String uid)
    {
        checkInEventLoop();
        List<Session> bucket = uidMap.get(uid);
        return bucket == null ? null : List.copyOf(bucket);
    }

    // ========== Binding ==========

    @Override
    public void bind(long sid, String uid, Callback callback)
    {
        checkInEventLoop();
        Objects.requireNonNull(uid, "uid");
        Callback cb = Callback.orNoop(callback);
        Session session = sessions.get(sid);

        if (session == null)
        {
            complete(cb, new SessionNotFoundException(sid));
            return;
        }

        if (session.getUid() != null)
        {
            if (session.getUid().equals(uid))
            {
                complete(cb, null);
                return;
            }
            complete(cb, new AlreadyBoundException(sid, session.getUid()));
            return;
        }

        List<Session> bucket = uidMap.get(uid);
        if (singleSession && bucket != null)
        {
            complete(cb, new SingleSessionViolationException(sid, uid));
            return;
        }

        if (bucket == null)
        {
            bucket = new ArrayList<>();
            uidMap.put(uid, bucket);
        }
        for (Session bound : bucket)
        {
            if (bound.getId() == sid)
            {
                complete(cb, null);
                return;
            }
        }
        bucket.add(session);

        session.bind(uid);
        LOG.debug("Session {} bound to uid {}", sid, uid);

        complete(cb, null);
    }

    @Override
    public void unbind(long sid, String uid, Callback callback)
    {
        checkInEventLoop();
        Objects.requireNonNull(uid, "uid");
        Callback cb = Callback.orNoop(callback);
        Session session = sessions.get(sid);

        if (session == null)
        {
            complete(cb, new SessionNotFoundException(sid));
            return;
        }

        if (!uid.equals(session.getUid()))
        {
            complete(cb, new NotBoundException(sid, uid));
            return;
        }

        removeFromBucket(uid, session);

        session.unbind(uid);
        LOG.debug("Session {} unbound from uid {}", sid, uid);

        complete(cb, null);
    }

    // ========== Settings ==========

    @Override
    public void importSetting(long sid, String key, SettingValue value, Callback callback)
    {
        checkInEventLoop();
        Callback cb = Callback.orNoop(callback);
        Session session = sessions.get(sid);
        if (session == null)
        {
            cb.onComplete(new SessionNotFoundException(sid));
            return;
        }
        session.set(key, value);
        cb.onComplete(null);
    }

    @Override
    public void importAll(long sid, Map<String, SettingValue> settings, Callback callback)
    {
        checkInEventLoop();
        Callback cb = Callback.orNoop(callback);
        Session session = sessions.get(sid);
        if (session == null)
        {
            cb.onComplete(new SessionNotFoundException(sid));
            return;
        }
        session.set(settings);
        cb.onComplete(null);
    }

    // ========== Kicking ==========

    @Override
    public void kick(String uid, Callback callback)
    {
        kick(uid, CloseReason.DEFAULT_KICK_MESSAGE, callback);
    }

    @Override
    public void kick(String uid, String reason, Callback callback)
    {
        checkInEventLoop();
        Callback cb = Callback.orNoop(callback);
        List<Session> bucket = uidMap.get(uid);

        try
        {
            if (bucket != null)
            {
                // Closing deregisters, which mutates the bucket
                List<Session> targets = new ArrayList<>(bucket);
                LOG.debug("Kicking {} session(s) of uid {}: {}", targets.size(), uid, reason);
                closeEach(targets, CloseReason.kicked(reason));
            }
        }
        finally
        {
            complete(cb, null);
        }
    }

    @Override
    public void kickBySessionId(long sid, Callback callback)
    {
        kickBySessionId(sid, CloseReason.DEFAULT_KICK_MESSAGE, callback);
    }

    @Override
    public void kickBySessionId(long sid, String reason, Callback callback)
    {
        checkInEventLoop();
        Callback cb = Callback.orNoop(callback);
        Session session = sessions.get(sid);

        try
        {
            if (session != null)
            {
                LOG.debug("Kicking session {}: {}", sid, reason);
                session.closed(CloseReason.kicked(reason));
            }
        }
        finally
        {
            complete(cb, null);
        }
    }

    /**
     * Closes every registered session.
     *
     * <p>A throwing close listener does not stop the remaining sessions from
     * closing. The first failure is rethrown afterwards.</p>
     *
     * @param reason the reason given to each session
     */
    public void closeAll(CloseReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        checkInEventLoop();
        LOG.info("Closing all {} session(s): {}", sessions.size(), reason);
        closeEach(new ArrayList<>(sessions.values()), reason);
    }

    /**
     * Closes every session with {@link CloseReason.ServerShutdown} and closes
     * the event loop if the factory created it.
     *
     * <p>May be called from any thread. Off the event loop, the sessions are
     * closed by a task on the loop and this call waits for it. Later calls
     * do nothing.</p>
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        LOG.info("Closing session service on [{}]", frontendId);
        try
        {
            if (eventLoop.inEventLoop())
            {
                closeAll(new CloseReason.ServerShutdown());
            }
            else
            {
                runOnEventLoopAndWait(() -> closeAll(new CloseReason.ServerShutdown()));
            }
        }
        finally
        {
            if (ownedEventLoop != null)
            {
                ownedEventLoop.close();
            }
        }
        LOG.info("Session service on [{}] closed", frontendId);
    }

    // ========== Messaging ==========

    @Override
    public SocketAddress getClientAddressBySessionId(long sid)
    {
        checkInEventLoop();
        Session session = sessions.get(sid);
        return session == null ? null : session.getRemoteAddress();
    }

    @Override
    public boolean sendMessage(long sid, Object message)
    {
        checkInEventLoop();
        Session session = sessions.get(sid);
        if (session == null)
        {
            LOG.debug("Fail to send message for non-existing session, sid: {} msg: {}", sid, message);
            return false;
        }
        session.send(message);
        return true;
    }

    @Override
    public boolean sendMessageByUid(String uid, Object message)
    {
        checkInEventLoop();
        List<Session> bucket = uidMap.get(uid);
        if (bucket == null)
        {
            LOG.debug("Fail to send message by uid for non-existing session, uid: {}", uid);
            return false;
        }
        for (Session session : bucket)
        {
            session.send(message);
        }
        return true;
    }

    // ========== Iteration ==========

    /**
     * Visits every registered session.
     *
     * <p>Iterates over a snapshot, so the action may close sessions.</p>
     *
     * @param action the action
     */
    public void forEachSession(Consumer<Session> action)
    {
        Objects.requireNonNull(action, "action");
        checkInEventLoop();
        for (Session session : new ArrayList<>(sessions.values()))
        {
            action.accept(session);
        }
    }

    /**
     * Visits every session bound to a user id.
     *
     * <p>Iterates over a snapshot, so the action may close sessions.</p>
     *
     * @param action the action
     */
    public void forEachBoundSession(Consumer<Session> action)
    {
        Objects.requireNonNull(action, "action");
        checkInEventLoop();
        List<Session> bound = new ArrayList<>();
        for (List<Session> bucket : uidMap.values())
        {
            bound.addAll(bucket);
        }
        for (Session session : bound)
        {
            action.accept(session);
        }
    }

    // ========== Queries ==========

    @Override
    public int getSessionsCount()
    {
        checkInEventLoop();
        return sessions.size();
    }

    @Override
    public boolean isSingleSession()
    {
        return singleSession;
    }

    /**
     * Returns the frontend id used by {@link #create(long, Socket)}.
     */
    public String getFrontendId()
    {
        return frontendId;
    }

    // ========== SessionCallback ==========

    @Override
    public void onSessionClosed(Session session)
    {
        // A session replaced under a duplicate id must not evict its replacement
        if (sessions.get(session.getId()) == session)
        {
            remove(session.getId());
        }
        else if (session.getUid() != null)
        {
            removeFromBucket(session.getUid(), session);
        }
    }

    @Override
    public EventLoop getEventLoop()
    {
        return eventLoop;
    }

    @Override
    public SessionService getSessionService()
    {
        return this;
    }

    // ========== Internal ==========

    private void checkInEventLoop()
    {
        if (!eventLoop.inEventLoop())
        {
            throw new IllegalStateException("Session service on [" + frontendId
                    + "] called off its event loop from thread " + Thread.currentThread().getName());
        }
    }

    private void removeFromBucket(String uid, Session session)
    {
        List<Session> bucket = uidMap.get(uid);
        if (bucket == null)
        {
            return;
        }
        Iterator<Session> it = bucket.iterator();
        while (it.hasNext())
        {
            if (it.next() == session)
            {
                it.remove();
                break;
            }
        }
        if (bucket.isEmpty())
        {
            uidMap.remove(uid);
        }
    }

    private void closeEach(List<Session> targets, CloseReason reason)
    {
        RuntimeException failure = null;
        for (Session session : targets)
        {
            try
            {
                session.closed(reason);
            }
            catch (RuntimeException e)
            {
                if (failure == null)
                {
                    failure = e;
                }
                else
                {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null)
        {
            throw failure;
        }
    }

    private void runOnEventLoopAndWait(Runnable task)
    {
        CountDownLatch done = new CountDownLatch(1);
        eventLoop.execute(() ->
        {
            try
            {
                task.run();
            }
            finally
            {
                done.countDown();
            }
        });
        try
        {
            if (!done.await(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
            {
                LOG.warn("Sessions on [{}] were not closed within {}", frontendId, SHUTDOWN_TIMEOUT);
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing sessions on [{}]", frontendId);
        }
    }

    private void complete(Callback callback, SessionException error)
    {
        eventLoop.execute(() -> callback.onComplete(error));
    }
}
