package com.ashby.supervisor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Controllable stand-in for an OS process.
 */
class FakeProcess extends Process {

    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
    private final InputStream stdout = new ByteArrayInputStream(new byte[0]);
    private final InputStream stderr;
    private final CompletableFuture<Process> exit = new CompletableFuture<>();
    private volatile int exitCode;
    private volatile boolean exitsOnDestroy = true;

    FakeProcess(String... stderrLines) {
        String text = stderrLines.length == 0 ? "" : String.join("\n", stderrLines) + "\n";
        this.stderr = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    /** A process that ignores polite termination. */
    FakeProcess stubborn() {
        exitsOnDestroy = false;
        return this;
    }

    void exit(int code) {
        exitCode = code;
        exit.complete(this);
    }

    String written() {
        synchronized (stdin) {
            return stdin.toString(StandardCharsets.UTF_8);
        }
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() {
        exit.join();
        return exitCode;
    }

    @Override
    public int exitValue() {
        if (!exit.isDone()) {
            throw new IllegalThreadStateException("still running");
        }
        return exitCode;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public CompletableFuture<Process> onExit() {
        return exit;
    }

    @Override
    public void destroy() {
        if (exitsOnDestroy) {
            exit(143);
        }
    }

    @Override
    public Process destroyForcibly() {
        exit(137);
        return this;
    }
}
