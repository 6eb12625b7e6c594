package com.ashby.mcp;

import java.io.InputStream;

/**
 * A byte-oriented, line-delimited channel to one plugin process.
 * Outgoing frames are written with {@link #send}; incoming frames are read from {@link #input()}.
 */
public interface Transport extends AutoCloseable {

    /**
     * Stable id of the transport; for subprocess transports this is the supervisor's process id.
     */
    String id();

    /**
     * Writes bytes to the peer.
     *
     * @throws TransportClosedException if the transport can no longer accept data
     */
    void send(byte[] bytes);

    /**
     * Stream of bytes produced by the peer. EOF means the peer is gone.
     */
    InputStream input();

    boolean isOpen();

    @Override
    void close();
}
