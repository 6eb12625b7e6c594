package com.ashby.supervisor;

import com.ashby.mcp.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@link Transport} over a supervised process: frames go to its stdin, come back on its stdout.
 * Writes are routed through {@link ProcessSupervisor#send} so a dead process is reported as
 * {@link ProcessNotRunningException}. Closing the transport does not stop the process.
 */
class ProcessTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(ProcessTransport.class);

    private final ManagedProcess managed;
    private final ProcessSupervisor supervisor;
    private volatile boolean open = true;

    ProcessTransport(ManagedProcess managed, ProcessSupervisor supervisor) {
        this.managed = managed;
        this.supervisor = supervisor;
    }

    @Override
    public String id() {
        return managed.id();
    }

    @Override
    public void send(byte[] bytes) {
        supervisor.send(managed.id(), bytes);
    }

    @Override
    public InputStream input() {
        return managed.process().getInputStream();
    }

    @Override
    public boolean isOpen() {
        return open && managed.isRunning();
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            managed.process().getOutputStream().close();
        } catch (IOException e) {
            log.debug("Error closing stdin of {}: {}", managed.id(), e.getMessage());
        }
        try {
            managed.process().getInputStream().close();
        } catch (IOException e) {
            log.debug("Error closing stdout of {}: {}", managed.id(), e.getMessage());
        }
    }
}
