package com.ashby.core.security;

import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether a package may be installed and executed.
 * <p>
 * A package is allowed only when its name passes {@link PackageNames#isValidPackage} and matches
 * at least one configured pattern. Patterns are literal names with {@code *} wildcards.
 * An empty allow-list denies everything.
 */
@Service
public class PackageAllowlistService {

    private final SecurityProperties securityProperties;

    public PackageAllowlistService(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public boolean isPackageAllowed(String packageName) {
        if (!PackageNames.isValidPackage(packageName)) {
            return false;
        }
        List<String> allowlist = securityProperties.getPackageAllowlist();
        if (allowlist == null || allowlist.isEmpty()) {
            return false;
        }

        for (String pattern : allowlist) {
            if (matches(pattern, packageName)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String packageName) {
        if (!pattern.contains("*")) {
            return pattern.equals(packageName);
        }
        String regex = Arrays.stream(pattern.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return Pattern.matches(regex, packageName);
    }
}
