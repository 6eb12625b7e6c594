package com.ashby.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Allow-list configuration applied at the discovery and installer boundary.
 *
 * <pre>
 * ashby:
 *   security:
 *     package-allowlist:
 *       - "@modelcontextprotocol/server-*"
 *       - "*mcp*"
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "ashby.security")
public class SecurityProperties {

    private List<String> packageAllowlist = List.of("*");

    public List<String> getPackageAllowlist() {
        return packageAllowlist;
    }

    public void setPackageAllowlist(List<String> packageAllowlist) {
        this.packageAllowlist = packageAllowlist;
    }
}
