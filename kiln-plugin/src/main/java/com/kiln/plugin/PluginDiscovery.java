package com.kiln.plugin;

import com.kiln.component.ComponentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Finds plugin executables named {@code kiln-<kind>-<name>} on a search path. Directories are
 * searched in order and the first match wins. Missing or unreadable directories are skipped.
 */
public final class PluginDiscovery {

    private static final Logger log = LoggerFactory.getLogger(PluginDiscovery.class);

    public static final String EXECUTABLE_PREFIX = "kiln-";

    private final List<Path> searchPath;

    public PluginDiscovery(List<Path> searchPath) {
        this.searchPath = List.copyOf(searchPath);
    }

    public List<Path> getSearchPath() {
        return searchPath;
    }

    public static String executableName(ComponentKind kind, String name) {
        return EXECUTABLE_PREFIX + kind.wireName() + "-" + name;
    }

    /** First executable for {@code kind}/{@code name} on the search path. */
    public Optional<Path> find(ComponentKind kind, String name) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains("\\") || name.equals("..")) {
            return Optional.empty();
        }
        String fileName = executableName(kind, name);
        for (Path dir : searchPath) {
            Path candidate = dir.resolve(fileName);
            if (isExecutable(candidate)) {
                log.debug("Found {} plugin {} at {}", kind, name, candidate);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Every discoverable component of {@code kind}, by name; earlier directories shadow later ones. */
    public Map<String, Path> discover(ComponentKind kind) {
        String prefix = EXECUTABLE_PREFIX + kind.wireName() + "-";
        Map<String, Path> found = new TreeMap<>();
        for (Path dir : searchPath) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, prefix + "*")) {
                for (Path candidate : stream) {
                    String name = candidate.getFileName().toString().substring(prefix.length());
                    if (!name.isEmpty() && isExecutable(candidate)) {
                        found.putIfAbsent(name, candidate);
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to list plugin directory {}: {}", dir, e.getMessage());
            }
        }
        return found;
    }

    private static boolean isExecutable(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }
}
