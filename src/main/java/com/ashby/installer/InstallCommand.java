package com.ashby.installer;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * The external tool that materializes a package into a directory.
 */
@FunctionalInterface
public interface InstallCommand {

    CommandResult run(String packageName, String version, Path workingDir, Duration timeout) throws IOException;
}
