package com.ashby.installer;

/**
 * Outcome of an external install command.
 *
 * @param exitCode process exit code, -1 when it had to be killed
 * @param output   tail of combined stdout/stderr
 * @param timedOut whether the command exceeded its timeout
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
