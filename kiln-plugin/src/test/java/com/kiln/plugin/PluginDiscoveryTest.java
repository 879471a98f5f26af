package com.kiln.plugin;

import com.kiln.component.ComponentKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnabledOnOs({OS.LINUX, OS.MAC})
class PluginDiscoveryTest {

    @TempDir
    Path tmp;

    @Test
    void firstDirectoryOnSearchPathWins() throws Exception {
        Path first = Files.createDirectories(tmp.resolve("first"));
        Path second = Files.createDirectories(tmp.resolve("second"));
        Scripts.write(second, "kiln-builder-docker", "exit 0");
        Path winner = Scripts.write(first, "kiln-builder-docker", "exit 0");

        PluginDiscovery discovery = new PluginDiscovery(List.of(tmp.resolve("missing"), first, second));

        assertEquals(Optional.of(winner), discovery.find(ComponentKind.BUILDER, "docker"));
        assertEquals(Map.of("docker", winner), discovery.discover(ComponentKind.BUILDER));
    }

    @Test
    void nonExecutableFilesAndOtherKindsAreIgnored() throws Exception {
        Files.writeString(tmp.resolve("kiln-builder-plain"), "not executable");
        Scripts.write(tmp, "kiln-post-processor-compress", "exit 0");
        Scripts.write(tmp, "kiln-provisioner-ansible", "exit 0");

        PluginDiscovery discovery = new PluginDiscovery(List.of(tmp));

        assertTrue(discovery.find(ComponentKind.BUILDER, "plain").isEmpty());
        assertEquals(List.of("compress"), List.copyOf(discovery.discover(ComponentKind.POST_PROCESSOR).keySet()));
        assertEquals(List.of("ansible"), List.copyOf(discovery.discover(ComponentKind.PROVISIONER).keySet()));
        assertTrue(discovery.discover(ComponentKind.HOOK).isEmpty());
    }

    @Test
    void namesCannotEscapeTheSearchDirectories() throws Exception {
        Path inner = Files.createDirectories(tmp.resolve("inner"));
        Scripts.write(tmp, "x", "exit 0");

        PluginDiscovery discovery = new PluginDiscovery(List.of(inner));

        assertTrue(discovery.find(ComponentKind.BUILDER, "../../x").isEmpty());
        assertTrue(discovery.find(ComponentKind.BUILDER, "").isEmpty());
    }
}
