package com.ashby.supervisor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over OS process creation.
 * Implementations: {@link LocalProcessLauncher} (ProcessBuilder); tests supply in-memory processes.
 */
public interface ProcessLauncher {

    /**
     * Starts {@code command} (executable followed by its arguments) in {@code workingDir}.
     * stdin, stdout and stderr must be left as pipes.
     */
    Process launch(List<String> command, Path workingDir) throws IOException;
}
