package com.ashby.installer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code npm install --prefix <dir> --no-audit --no-fund <name>@<version>}.
 * Combined output goes to {@code install.log} inside the install directory.
 */
@Component
public class NpmInstallCommand implements InstallCommand {

    private static final Logger log = LoggerFactory.getLogger(NpmInstallCommand.class);
    static final String LOG_FILE = "install.log";

    private final InstallerProperties properties;

    public NpmInstallCommand(InstallerProperties properties) {
        this.properties = properties;
    }

    List<String> command(String packageName, String version, Path workingDir) {
        return List.of(properties.getNpmCommand(), "install",
                "--prefix", workingDir.toString(),
                "--no-audit", "--no-fund",
                packageName + "@" + version);
    }

    @Override
    public CommandResult run(String packageName, String version, Path workingDir, Duration timeout) throws IOException {
        List<String> command = command(packageName, version, workingDir);
        Path logFile = workingDir.resolve(LOG_FILE);
        log.info("Running {}", String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while installing " + packageName, e);
        }
        if (!finished) {
            process.destroyForcibly();
            return new CommandResult(-1, tail(logFile), true);
        }
        return new CommandResult(process.exitValue(), tail(logFile), false);
    }

    private String tail(Path logFile) throws IOException {
        if (!Files.exists(logFile)) {
            return "";
        }
        String output = Files.readString(logFile, StandardCharsets.UTF_8);
        int max = properties.getOutputTailChars();
        return output.length() <= max ? output : output.substring(output.length() - max);
    }
}
