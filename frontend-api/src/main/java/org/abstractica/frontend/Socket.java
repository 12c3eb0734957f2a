package org.abstractica.frontend;

import java.net.SocketAddress;
import java.util.List;

/**
 * Transport-level connection handle held by a session.
 *
 * <p>Implemented by the transport layer. The session layer treats it as
 * opaque: it forwards outgoing messages, announces that closing has begun
 * and finally asks the transport to disconnect.</p>
 */
public interface Socket
{
    /**
     * Sends one message to the client.
     *
     * @param message the message
     */
    void send(Object message);

    /**
     * Sends several messages to the client in one batch.
     *
     * @param messages the messages, in sending order
     */
    void sendBatch(List<?> messages);

    /**
     * Signals that the owning session has started closing.
     *
     * <p>Called once, before {@link #disconnect()}, so the transport can
     * tell the client why it is being dropped.</p>
     *
     * @param reason why the session is closing
     */
    void notifyClosing(CloseReason reason);

    /**
     * Tears down the connection.
     */
    void disconnect();

    /**
     * Returns the client's address.
     *
     * @return the remote address, or null if the transport does not know it
     */
    SocketAddress getRemoteAddress();
}
