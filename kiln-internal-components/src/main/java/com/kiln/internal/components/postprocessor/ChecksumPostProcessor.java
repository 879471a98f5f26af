package com.kiln.internal.components.postprocessor;

import com.kiln.component.Artifact;
import com.kiln.component.ConfigBundle;
import com.kiln.component.PostProcessResult;
import com.kiln.component.PostProcessor;
import com.kiln.component.error.BuildException;
import com.kiln.config.ConfigDecoder;
import com.kiln.ui.Ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes {@code <file>.<algorithm>} next to every file of the artifact, in the
 * {@code <hex>  <name>} format understood by {@code sha256sum -c} and friends.
 */
public final class ChecksumPostProcessor implements PostProcessor {

    public static final String BUILDER_ID = "kiln.post-processor.checksum";

    private static final Map<String, String> ALGORITHMS = Map.of(
            "md5", "MD5",
            "sha1", "SHA-1",
            "sha224", "SHA-224",
            "sha256", "SHA-256",
            "sha384", "SHA-384",
            "sha512", "SHA-512");

    private String algorithm = "sha256";
    private boolean keepInputArtifact = true;

    @Override
    public void configure(List<ConfigBundle> raws) {
        ConfigDecoder d = ConfigDecoder.of(raws);
        algorithm = d.optionalString("algorithm", "sha256").toLowerCase(Locale.ROOT);
        keepInputArtifact = d.optionalBoolean("keep_input_artifact", true);
        if (!ALGORITHMS.containsKey(algorithm)) {
            d.error("algorithm: unsupported checksum algorithm '" + algorithm + "'");
        }
        d.rejectUnknownKeys();
        d.validate();
    }

    @Override
    public PostProcessResult postProcess(Ui ui, Artifact artifact) {
        List<String> written = new ArrayList<>();
        for (String file : artifact.files()) {
            Path path = Path.of(file);
            Path sum = path.resolveSibling(path.getFileName() + "." + algorithm);
            ui.message("Computing " + algorithm + " of " + path);
            try {
                Files.writeString(sum, digest(path) + "  " + path.getFileName() + "\n", StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new BuildException("Failed to checksum " + path + ": " + e.getMessage(), e);
            }
            written.add(sum.toString());
        }
        Artifact out = new Artifact(BUILDER_ID, artifact.id(), written,
                algorithm + " checksums of " + artifact);
        return new PostProcessResult(out, keepInputArtifact);
    }

    private String digest(Path path) throws IOException {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHMS.get(algorithm));
        } catch (NoSuchAlgorithmException e) {
            throw new BuildException("Checksum algorithm " + algorithm + " is not available", e);
        }
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(path)) {
            int n;
            while ((n = in.read(buffer)) > 0) {
                md.update(buffer, 0, n);
            }
        }
        return HexFormat.of().formatHex(md.digest());
    }
}
