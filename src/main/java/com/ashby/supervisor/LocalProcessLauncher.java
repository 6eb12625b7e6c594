package com.ashby.supervisor;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches processes with {@link ProcessBuilder}. The command is passed as an argument array;
 * nothing is interpreted by a shell.
 */
@Component
public class LocalProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, Path workingDir) throws IOException {
        return new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectErrorStream(false)
                .start();
    }
}
