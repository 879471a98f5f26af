package com.kiln.internal.components.builder;

import com.kiln.cache.FileCache;
import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.error.BuildException;
import com.kiln.component.error.ConfigException;
import com.kiln.internal.components.RecordingHook;
import com.kiln.internal.components.RecordingUi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NullBuilderTest {

    @TempDir
    Path tmp;

    @Test
    void runsProvisionHookAndReturnsConfiguredArtifact() {
        NullBuilder builder = new NullBuilder();
        builder.prepare(List.of(ConfigBundle.of(Map.of("artifact_id", "img-1", "files", List.of("a", "b")))));
        RecordingUi ui = new RecordingUi();
        RecordingHook hook = new RecordingHook();

        Artifact artifact = builder.run(ui, hook, new FileCache(tmp));

        assertEquals(NullBuilder.BUILDER_ID, artifact.builderId());
        assertEquals("img-1", artifact.id());
        assertEquals(List.of("a", "b"), artifact.files());
        assertEquals(List.of(Hook.PROVISION), hook.ran);
        assertTrue(ui.saidContaining("img-1"));
    }

    @Test
    void laterBundlesOverrideEarlierOnes() {
        NullBuilder builder = new NullBuilder();
        builder.prepare(List.of(
                ConfigBundle.of(Map.of("artifact_id", "base")),
                ConfigBundle.of(Map.of("artifact_id", "override"))));

        Artifact artifact = builder.run(new RecordingUi(), new RecordingHook(), new FileCache(tmp));

        assertEquals("override", artifact.id());
    }

    @Test
    void reportsEveryConfigurationProblem() {
        NullBuilder builder = new NullBuilder();

        ConfigException e = assertThrows(ConfigException.class,
                () -> builder.prepare(List.of(ConfigBundle.of(Map.of("bogus", true)))));

        assertEquals(List.of("artifact_id must be specified", "unknown configuration key: 'bogus'"), e.getErrors());
    }

    @Test
    void cancelledRunFails() {
        NullBuilder builder = new NullBuilder();
        builder.prepare(List.of(ConfigBundle.of(Map.of("artifact_id", "x"))));
        builder.cancel();

        assertThrows(BuildException.class, () -> builder.run(new RecordingUi(), new RecordingHook(), new FileCache(tmp)));
    }
}
