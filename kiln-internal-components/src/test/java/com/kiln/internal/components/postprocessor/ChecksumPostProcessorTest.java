package com.kiln.internal.components.postprocessor;

import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;
import com.kiln.component.PostProcessResult;
import com.kiln.component.error.ConfigException;
import com.kiln.internal.components.RecordingUi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChecksumPostProcessorTest {

    @TempDir
    Path tmp;

    @Test
    void writesChecksumFileNextToEachFile() throws Exception {
        Path file = Files.writeString(tmp.resolve("disk.img"), "hello\n");
        ChecksumPostProcessor pp = new ChecksumPostProcessor();
        pp.configure(List.of(ConfigBundle.empty()));

        PostProcessResult result = pp.postProcess(new RecordingUi(),
                new Artifact("kiln.file", "disk", List.of(file.toString()), null));

        Path sum = tmp.resolve("disk.img.sha256");
        String expected = HexFormat.of().formatHex(
                MessageDigest.getInstance("SHA-256").digest("hello\n".getBytes(StandardCharsets.UTF_8)));
        assertEquals(expected + "  disk.img\n", Files.readString(sum));
        assertEquals(List.of(sum.toString()), result.artifact().files());
        assertEquals(ChecksumPostProcessor.BUILDER_ID, result.artifact().builderId());
        assertTrue(result.keepOriginal());
    }

    @Test
    void honorsAlgorithmAndKeepInputArtifact() throws Exception {
        Path file = Files.writeString(tmp.resolve("a.bin"), "x");
        ChecksumPostProcessor pp = new ChecksumPostProcessor();
        pp.configure(List.of(ConfigBundle.of(Map.of("algorithm", "MD5", "keep_input_artifact", false))));

        PostProcessResult result = pp.postProcess(new RecordingUi(),
                new Artifact("kiln.file", "a", List.of(file.toString()), null));

        assertTrue(Files.exists(tmp.resolve("a.bin.md5")));
        assertFalse(result.keepOriginal());
    }

    @Test
    void rejectsUnknownAlgorithm() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> new ChecksumPostProcessor().configure(List.of(ConfigBundle.of(Map.of("algorithm", "crc")))));

        assertEquals(List.of("algorithm: unsupported checksum algorithm 'crc'"), e.getErrors());
    }
}
