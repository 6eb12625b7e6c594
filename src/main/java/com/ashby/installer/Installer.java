package com.ashby.installer;

import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.InstallStatus;
import com.ashby.core.model.InstalledPackage;
import com.ashby.core.security.PackageAllowlistService;
import com.ashby.core.security.PackageNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Materializes candidate packages on disk, one fresh directory per install.
 * <p>
 * An install succeeds only if the command exits 0 and the package directory exists afterward.
 * Failures are not retried here. Directories are removed only by {@link #cleanup}.
 */
@Service
public class Installer {

    private static final Logger log = LoggerFactory.getLogger(Installer.class);

    private final InstallCommand installCommand;
    private final InstallerProperties properties;
    private final PackageAllowlistService allowlist;

    private final Map<String, InstalledPackage> installs = new ConcurrentHashMap<>();

    public Installer(InstallCommand installCommand, InstallerProperties properties,
                     PackageAllowlistService allowlist) {
        this.installCommand = installCommand;
        this.properties = properties;
        this.allowlist = allowlist;
    }

    /**
     * @throws InstallFailedException if the name is rejected, the command fails,
     *                                or the package is missing afterward
     */
    public InstalledPackage install(CandidateServer candidate) {
        String name = candidate.packageName();
        String version = candidate.version();
        if (!PackageNames.isValidPackage(name) || !PackageNames.isValidVersion(version)) {
            throw new InstallFailedException("Rejected package spec: " + name + "@" + version);
        }
        if (!allowlist.isPackageAllowed(name)) {
            throw new InstallFailedException("Package not in allow-list: " + name);
        }

        Path dir;
        try {
            Files.createDirectories(properties.getInstallRoot());
            dir = Files.createTempDirectory(properties.getInstallRoot(), dirPrefix(name));
        } catch (IOException e) {
            throw new InstallFailedException("Cannot create install directory under "
                    + properties.getInstallRoot() + ": " + e.getMessage(), null, e);
        }
        String id = dir.getFileName().toString();
        var installing = new InstalledPackage(id, name, version, dir, InstallStatus.INSTALLING, null, null);
        installs.put(id, installing);
        log.info("Installing {}@{} into {}", name, version, dir);

        CommandResult result;
        try {
            result = installCommand.run(name, version, dir, properties.getCommandTimeout());
        } catch (IOException e) {
            throw fail(installing, "Install command could not run: " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            throw fail(installing, "Install timed out after " + properties.getCommandTimeout(), null);
        }
        if (result.exitCode() != 0) {
            throw fail(installing, "Install exited with code " + result.exitCode() + lastLine(result.output()), null);
        }
        if (!Files.isDirectory(installing.packageDir())) {
            throw fail(installing, "Install reported success but " + installing.packageDir() + " is missing", null);
        }

        var installed = new InstalledPackage(id, name, version, dir, InstallStatus.INSTALLED, null, Instant.now());
        installs.put(id, installed);
        log.info("Installed {}@{} ({})", name, version, id);
        return installed;
    }

    /**
     * Deletes the install directory and forgets the record.
     */
    public void cleanup(InstalledPackage installed) {
        Path dir = installed.installDir();
        if (!dir.normalize().startsWith(properties.getInstallRoot().normalize())) {
            throw new IllegalArgumentException("Refusing to delete outside install root: " + dir);
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
            log.info("Removed install {} ({})", installed.id(), installed.packageName());
        } catch (IOException e) {
            log.warn("Failed to remove {}: {}", dir, e.getMessage());
        }
        installs.remove(installed.id());
    }

    public List<InstalledPackage> listInstalled() {
        return installs.values().stream()
                .sorted(Comparator.comparing(InstalledPackage::id))
                .toList();
    }

    private InstallFailedException fail(InstalledPackage installing, String reason, Throwable cause) {
        var failed = new InstalledPackage(installing.id(), installing.packageName(), installing.version(),
                installing.installDir(), InstallStatus.FAILED, reason, Instant.now());
        installs.put(failed.id(), failed);
        log.warn("Install of {} failed: {}", installing.packageName(), reason);
        return new InstallFailedException(reason, failed, cause);
    }

    private static String dirPrefix(String packageName) {
        return packageName.replace("@", "").replace('/', '-') + "-";
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        String[] lines = output.strip().split("\\R");
        return ": " + lines[lines.length - 1];
    }
}
