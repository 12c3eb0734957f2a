package org.abstractica.demo.frontend;

import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.Socket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;

/**
 * In-memory socket that logs everything sent through it.
 */
class LoggingSocket implements Socket
{
    private static final Logger LOG = LoggerFactory.getLogger(LoggingSocket.class);

    private final String name;
    private final SocketAddress remoteAddress;

    LoggingSocket(String name, int port)
    {
        this.name = name;
        this.remoteAddress = new InetSocketAddress("127.0.0.1", port);
    }

    @Override
    public void send(Object message)
    {
        LOG.info("[{}] <- {}", name, message);
    }

    @Override
    public void sendBatch(List<?> messages)
    {
        LOG.info("[{}] <- batch of {}: {}", name, messages.size(), messages);
    }

    @Override
    public void notifyClosing(CloseReason reason)
    {
        LOG.info("[{}] closing: {}", name, reason);
    }

    @Override
    public void disconnect()
    {
        LOG.info("[{}] disconnected", name);
    }

    @Override
    public SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }
}
