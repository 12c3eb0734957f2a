package org.abstractica.frontend.impl.session;

import org.abstractica.frontend.CloseReason;
import org.abstractica.frontend.Socket;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Socket that records every call for assertions.
 */
public class RecordingSocket implements Socket
{
    public final List<Object> sent = new ArrayList<>();
    public final List<List<?>> batches = new ArrayList<>();
    public final List<CloseReason> closingReasons = new ArrayList<>();
    public int disconnects = 0;

    private final SocketAddress remoteAddress;

    public RecordingSocket()
    {
        this(new InetSocketAddress("127.0.0.1", 40000));
    }

    public RecordingSocket(SocketAddress remoteAddress)
    {
        this.remoteAddress = remoteAddress;
    }

    @Override
    public void send(Object message)
    {
        sent.add(message);
    }

    @Override
    public void sendBatch(List<?> messages)
    {
        batches.add(List.copyOf(messages));
    }

    @Override
    public void notifyClosing(CloseReason reason)
    {
        closingReasons.add(reason);
    }

    @Override
    public void disconnect()
    {
        disconnects++;
    }

    @Override
    public SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }
}
