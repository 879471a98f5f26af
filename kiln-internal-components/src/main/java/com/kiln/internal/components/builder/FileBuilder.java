package com.kiln.internal.components.builder;

import com.kiln.cache.Cache;
import com.kiln.cache.CacheLease;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.error.BuildException;
import com.kiln.config.ConfigDecoder;
import com.kiln.ui.Ui;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes one file. With {@code source}, the file's content is kept in the cache under that key:
 * a cached copy is reused, otherwise {@code content} is written and stored for later builds.
 */
public final class FileBuilder implements Builder {

    public static final String BUILDER_ID = "kiln.file";

    private Path target;
    private String content = "";
    private String source;
    private volatile boolean cancelled;

    @Override
    public List<String> prepare(List<ConfigBundle> raws) {
        ConfigDecoder d = ConfigDecoder.of(raws);
        String t = d.requireString("target");
        content = d.optionalString("content", "");
        source = d.optionalString("source", null);
        if (source != null && source.isBlank()) {
            d.error("source must not be empty");
        }
        d.rejectUnknownKeys();
        d.validate();
        target = Path.of(t);
        return source == null && content.isEmpty()
                ? List.of("content is empty; " + target + " will be an empty file")
                : List.of();
    }

    @Override
    public Artifact run(Ui ui, Hook hook, Cache cache) {
        if (cancelled) {
            throw new BuildException("Build was cancelled");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (source == null) {
                ui.say("Writing " + target);
                Files.writeString(target, content, StandardCharsets.UTF_8);
            } else {
                try (CacheLease lease = cache.acquire(source)) {
                    if (Files.isRegularFile(lease.path())) {
                        ui.say("Copying cached " + source + " to " + target);
                    } else {
                        ui.say("Caching " + source);
                        Files.writeString(lease.path(), content, StandardCharsets.UTF_8);
                    }
                    Files.copy(lease.path(), target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        } catch (IOException e) {
            throw new BuildException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        return new Artifact(BUILDER_ID, target.toString(), List.of(target.toString()), "Stored file: " + target);
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
