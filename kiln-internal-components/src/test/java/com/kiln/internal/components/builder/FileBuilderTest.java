package com.kiln.internal.components.builder;

import com.kiln.cache.FileCache;
import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;
import com.kiln.component.error.ConfigException;
import com.kiln.internal.components.RecordingHook;
import com.kiln.internal.components.RecordingUi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileBuilderTest {

    @TempDir
    Path tmp;

    private Artifact build(Map<String, Object> config, FileCache cache, RecordingUi ui) {
        FileBuilder builder = new FileBuilder();
        builder.prepare(List.of(ConfigBundle.of(config)));
        return builder.run(ui, new RecordingHook(), cache);
    }

    @Test
    void writesContentToTarget() throws Exception {
        Path target = tmp.resolve("out/nested/hello.txt");

        Artifact artifact = build(Map.of("target", target.toString(), "content", "hello"),
                new FileCache(tmp.resolve("cache")), new RecordingUi());

        assertEquals("hello", Files.readString(target));
        assertEquals(FileBuilder.BUILDER_ID, artifact.builderId());
        assertEquals(List.of(target.toString()), artifact.files());
    }

    @Test
    void sourceIsCachedOnFirstBuildAndReusedAfterwards() throws Exception {
        FileCache cache = new FileCache(tmp.resolve("cache"));
        Path first = tmp.resolve("first.txt");
        Path second = tmp.resolve("second.txt");

        build(Map.of("target", first.toString(), "content", "v1", "source", "seed.txt"), cache, new RecordingUi());
        RecordingUi ui = new RecordingUi();
        build(Map.of("target", second.toString(), "content", "v2", "source", "seed.txt"), cache, ui);

        assertEquals("v1", Files.readString(second));
        assertTrue(ui.saidContaining("Copying cached seed.txt"));
        assertEquals("v1", Files.readString(cache.pathFor("seed.txt")));
    }

    @Test
    void emptyContentIsAWarning() {
        FileBuilder builder = new FileBuilder();

        List<String> warnings = builder.prepare(List.of(ConfigBundle.of(Map.of("target", tmp.resolve("x").toString()))));

        assertEquals(1, warnings.size());
    }

    @Test
    void targetIsRequired() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> new FileBuilder().prepare(List.of(ConfigBundle.of(Map.of("content", "x")))));

        assertEquals(List.of("target must be specified"), e.getErrors());
    }
}
