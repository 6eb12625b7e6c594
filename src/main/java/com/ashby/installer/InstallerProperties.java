package com.ashby.installer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ashby.installer")
public class InstallerProperties {

    /** Parent of every per-install directory. */
    private Path installRoot = Path.of(System.getProperty("java.io.tmpdir"), "ashby", "installs");

    /** Upper bound for a single install command. */
    private Duration commandTimeout = Duration.ofMinutes(5);

    private String npmCommand = "npm";

    /** Output kept from the install command for failure reports. */
    private int outputTailChars = 4000;

    public Path getInstallRoot() { return installRoot; }
    public void setInstallRoot(Path installRoot) { this.installRoot = installRoot.toAbsolutePath(); }
    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }
    public String getNpmCommand() { return npmCommand; }
    public void setNpmCommand(String npmCommand) { this.npmCommand = npmCommand; }
    public int getOutputTailChars() { return outputTailChars; }
    public void setOutputTailChars(int outputTailChars) { this.outputTailChars = outputTailChars; }
}
