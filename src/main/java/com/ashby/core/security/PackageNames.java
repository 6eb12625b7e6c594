package com.ashby.core.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strict syntax rules for names that end up as process arguments or URL components.
 * Anything outside these patterns is rejected before it reaches a command line.
 */
public final class PackageNames {

    /** npm package name: optional scope, lowercase, no path traversal, no whitespace. */
    private static final Pattern PACKAGE = Pattern.compile(
            "^(@[a-z0-9][a-z0-9._-]*/)?[a-z0-9][a-z0-9._-]*$");

    /** "latest", an exact semver, or a simple dist-tag. */
    private static final Pattern VERSION = Pattern.compile(
            "^(\\d+\\.\\d+\\.\\d+(-[0-9A-Za-z.-]+)?(\\+[0-9A-Za-z.-]+)?|[a-z][a-z0-9-]{0,31})$");

    private static final Pattern CAPABILITY = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,63}$");

    private static final int MAX_PACKAGE_LENGTH = 214;

    private PackageNames() {}

    public static boolean isValidPackage(String name) {
        return name != null
                && name.length() <= MAX_PACKAGE_LENGTH
                && !name.contains("..")
                && PACKAGE.matcher(name).matches();
    }

    public static boolean isValidVersion(String version) {
        return version != null && VERSION.matcher(version).matches();
    }

    public static boolean isValidCapability(String capability) {
        return capability != null && CAPABILITY.matcher(capability).matches();
    }

    /**
     * Lowercases and trims a capability name, mapping spaces to underscores.
     *
     * @throws IllegalArgumentException if the result is not a valid capability name
     */
    public static String normalizeCapability(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Capability name is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        if (!isValidCapability(normalized)) {
            throw new IllegalArgumentException("Invalid capability name: " + raw);
        }
        return normalized;
    }
}
