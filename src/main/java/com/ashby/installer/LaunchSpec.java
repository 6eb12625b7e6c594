package com.ashby.installer;

import java.nio.file.Path;
import java.util.List;

/**
 * How to start an installed server: executable, arguments, working directory.
 */
public record LaunchSpec(String executable, List<String> args, Path workingDir) {

    public LaunchSpec {
        args = List.copyOf(args);
    }
}
