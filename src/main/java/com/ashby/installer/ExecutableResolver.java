package com.ashby.installer;

import com.ashby.core.model.InstalledPackage;
import com.ashby.supervisor.SupervisorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the entry point of an installed server package.
 * <p>
 * Lookup order: {@code node_modules/.bin/<name>}, the {@code bin} field of the package's
 * {@code package.json} (a string, or a map where keys mentioning "mcp" or "server" win),
 * then its {@code main} field. JavaScript entry points are launched through node.
 */
@Component
public class ExecutableResolver {

    private static final Logger log = LoggerFactory.getLogger(ExecutableResolver.class);

    private final ObjectMapper objectMapper;
    private final SupervisorProperties supervisorProperties;

    public ExecutableResolver(ObjectMapper objectMapper, SupervisorProperties supervisorProperties) {
        this.objectMapper = objectMapper;
        this.supervisorProperties = supervisorProperties;
    }

    public Optional<LaunchSpec> resolve(InstalledPackage installed) {
        Path installDir = installed.installDir();
        Path packageDir = installed.packageDir();

        Path binLink = installDir.resolve("node_modules").resolve(".bin").resolve(unscoped(installed.packageName()));
        if (Files.isRegularFile(binLink)) {
            return Optional.of(launch(binLink, installDir));
        }

        Path manifest = packageDir.resolve("package.json");
        if (!Files.isRegularFile(manifest)) {
            log.warn("No package.json for {} in {}", installed.packageName(), packageDir);
            return Optional.empty();
        }
        JsonNode pkg;
        try {
            pkg = objectMapper.readTree(manifest.toFile());
        } catch (IOException e) {
            log.warn("Unreadable package.json for {}: {}", installed.packageName(), e.getMessage());
            return Optional.empty();
        }

        Optional<String> entry = binEntry(pkg.path("bin"));
        if (entry.isEmpty() && pkg.path("main").isTextual()) {
            entry = Optional.of(pkg.path("main").asText());
        }
        return entry
                .map(packageDir::resolve)
                .map(Path::normalize)
                .filter(p -> p.startsWith(packageDir))
                .filter(Files::isRegularFile)
                .map(p -> launch(p, installDir));
    }

    static Optional<String> binEntry(JsonNode bin) {
        if (bin.isTextual()) {
            return Optional.of(bin.asText());
        }
        if (!bin.isObject() || bin.isEmpty()) {
            return Optional.empty();
        }
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = bin.fields();
        it.forEachRemaining(entries::add);
        for (Map.Entry<String, JsonNode> e : entries) {
            String key = e.getKey().toLowerCase(Locale.ROOT);
            if (key.contains("mcp") || key.contains("server")) {
                return Optional.of(e.getValue().asText());
            }
        }
        return Optional.of(entries.get(0).getValue().asText());
    }

    /** Paths are made absolute: the child resolves relative ones against its own working directory. */
    private LaunchSpec launch(Path entry, Path workingDir) {
        String absolute = entry.toAbsolutePath().toString();
        Path dir = workingDir.toAbsolutePath();
        String file = entry.getFileName().toString();
        if (file.endsWith(".js") || file.endsWith(".mjs") || file.endsWith(".cjs")) {
            return new LaunchSpec(supervisorProperties.getNodeCommand(), List.of(absolute), dir);
        }
        return new LaunchSpec(absolute, List.of(), dir);
    }

    private static String unscoped(String packageName) {
        int slash = packageName.indexOf('/');
        return slash >= 0 ? packageName.substring(slash + 1) : packageName;
    }
}
