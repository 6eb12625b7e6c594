package com.ashby.installer;

import com.ashby.core.model.InstallStatus;
import com.ashby.core.model.InstalledPackage;
import com.ashby.supervisor.SupervisorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExecutableResolverTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private Path installDir;
    private ExecutableResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        installDir = Files.createDirectories(tmp.resolve("install"));
        resolver = new ExecutableResolver(mapper, new SupervisorProperties());
    }

    private InstalledPackage installed(String name) {
        return new InstalledPackage("i-1", name, "latest", installDir, InstallStatus.INSTALLED, null, Instant.now());
    }

    private Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    @DisplayName("prefers the .bin link named after the unscoped package")
    void binLink() throws IOException {
        Path link = write(installDir.resolve("node_modules/.bin/server-memory"), "#!/usr/bin/env node");

        Optional<LaunchSpec> spec = resolver.resolve(installed("@modelcontextprotocol/server-memory"));

        assertEquals(link.toString(), spec.orElseThrow().executable());
        assertEquals(installDir, spec.get().workingDir());
    }

    @Test
    @DisplayName("entry points under a relative install dir are made absolute")
    void relativeInstallDir() throws IOException {
        Path link = write(installDir.resolve("node_modules/.bin/mcp-server-x"), "#!/usr/bin/env node");
        Path relative = Path.of("").toAbsolutePath().relativize(installDir);
        var installed = new InstalledPackage("i-2", "mcp-server-x", "latest", relative,
                InstallStatus.INSTALLED, null, Instant.now());

        LaunchSpec spec = resolver.resolve(installed).orElseThrow();

        assertTrue(Path.of(spec.executable()).isAbsolute());
        assertEquals(link.toAbsolutePath().normalize(), Path.of(spec.executable()).normalize());
        assertEquals(installDir.toAbsolutePath().normalize(), spec.workingDir().normalize());
    }

    @Test
    @DisplayName("falls back to a JavaScript bin entry run through node")
    void binEntryThroughNode() throws IOException {
        Path pkg = installDir.resolve("node_modules/@modelcontextprotocol/server-memory");
        write(pkg.resolve("package.json"), "{\"bin\":{\"mcp-server-memory\":\"dist/index.js\"}}");
        Path entry = write(pkg.resolve("dist/index.js"), "console.log('hi')");

        LaunchSpec spec = resolver.resolve(installed("@modelcontextprotocol/server-memory")).orElseThrow();

        assertEquals("node", spec.executable());
        assertEquals(List.of(entry.toString()), spec.args());
    }

    @Test
    @DisplayName("uses main when there is no bin")
    void mainEntry() throws IOException {
        Path pkg = installDir.resolve("node_modules/mcp-server-x");
        write(pkg.resolve("package.json"), "{\"main\":\"server.mjs\"}");
        write(pkg.resolve("server.mjs"), "");

        assertTrue(resolver.resolve(installed("mcp-server-x")).isPresent());
    }

    @Test
    @DisplayName("entries escaping the package directory are ignored")
    void escapingEntry() throws IOException {
        Path pkg = installDir.resolve("node_modules/mcp-server-x");
        write(pkg.resolve("package.json"), "{\"bin\":\"../../../outside.js\"}");
        write(tmp.resolve("outside.js"), "");

        assertTrue(resolver.resolve(installed("mcp-server-x")).isEmpty());
    }

    @Test
    @DisplayName("a package without manifest has no entry point")
    void noManifest() {
        assertTrue(resolver.resolve(installed("mcp-server-x")).isEmpty());
    }

    @Test
    @DisplayName("bin maps prefer server-looking keys")
    void binMapPreference() throws IOException {
        var bin = mapper.readTree("{\"helper\":\"h.js\",\"my-server\":\"s.js\"}");
        assertEquals(Optional.of("s.js"), ExecutableResolver.binEntry(bin));
        assertEquals(Optional.of("h.js"), ExecutableResolver.binEntry(mapper.readTree("{\"helper\":\"h.js\"}")));
        assertEquals(Optional.empty(), ExecutableResolver.binEntry(mapper.readTree("{}")));
    }
}
