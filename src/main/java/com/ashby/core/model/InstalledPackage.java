package com.ashby.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Result of materializing a candidate on disk.
 * The install directory is reclaimed only by an explicit cleanup, never implicitly.
 *
 * @param id            unique install id (also the directory name)
 * @param packageName   the installed package
 * @param version       requested version
 * @param installDir    working directory the install ran in
 * @param status        install outcome
 * @param failureReason exit detail when {@code status} is FAILED, otherwise null
 * @param installedAt   when the install finished
 */
public record InstalledPackage(
    String id,
    String packageName,
    String version,
    Path installDir,
    InstallStatus status,
    String failureReason,
    Instant installedAt
) {
    /**
     * Directory npm places the package in: {@code <installDir>/node_modules/<packageName>}.
     * Scoped names resolve to a nested directory.
     */
    public Path packageDir() {
        Path dir = installDir.resolve("node_modules");
        for (String part : packageName.split("/")) {
            dir = dir.resolve(part);
        }
        return dir;
    }
}
