package com.ashby.installer;

import com.ashby.core.model.InstalledPackage;

public class InstallFailedException extends RuntimeException {

    private final transient InstalledPackage installed;

    public InstallFailedException(String message) {
        this(message, null, null);
    }

    public InstallFailedException(String message, InstalledPackage installed, Throwable cause) {
        super(message, cause);
        this.installed = installed;
    }

    /** The failed install record, or null when nothing was created on disk. */
    public InstalledPackage getInstalled() {
        return installed;
    }
}
