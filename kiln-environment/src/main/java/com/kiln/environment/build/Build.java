package com.kiln.environment.build;

import com.kiln.cache.Cache;
import com.kiln.component.Artifact;
import com.kiln.component.Builder;
import com.kiln.component.ConfigBundle;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessResult;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.component.error.ConfigException;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One builder with the provisioners, post-processors and hooks of its build description.
 * Prepare once, then run once.
 */
public final class Build {

    private static final Logger log = LoggerFactory.getLogger(Build.class);

    /** A loaded component with its display name and configuration. */
    public record Named<T>(String name, T component, ConfigBundle config) {
        public Named {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(component, "component");
            config = config != null ? config : ConfigBundle.empty();
        }
    }

    private final Named<Builder> builder;
    private final List<Named<Provisioner>> provisioners;
    private final List<Named<PostProcessor>> postProcessors;
    private final DispatchHook hook;
    private volatile boolean cancelled;

    public Build(Named<Builder> builder, List<Named<Provisioner>> provisioners,
                 List<Named<PostProcessor>> postProcessors, Map<String, List<Hook>> hooks) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.provisioners = List.copyOf(provisioners);
        this.postProcessors = List.copyOf(postProcessors);
        this.hook = new DispatchHook(this.provisioners, hooks);
    }

    public String getName() {
        return builder.name();
    }

    /**
     * Prepares every component, adding each configuration problem to {@code errors} prefixed with
     * the component's name.
     *
     * @return the builder's warnings
     */
    public List<String> prepare(List<String> errors) {
        List<String> warnings = new ArrayList<>();
        try {
            warnings.addAll(builder.component().prepare(List.of(builder.config())));
        } catch (ConfigException e) {
            e.getErrors().forEach(err -> errors.add(builder.name() + ": " + err));
        }
        for (Named<Provisioner> p : provisioners) {
            try {
                p.component().prepare(List.of(p.config()));
            } catch (ConfigException e) {
                e.getErrors().forEach(err -> errors.add(builder.name() + ": " + p.name() + ": " + err));
            }
        }
        for (Named<PostProcessor> pp : postProcessors) {
            try {
                pp.component().configure(List.of(pp.config()));
            } catch (ConfigException e) {
                e.getErrors().forEach(err -> errors.add(builder.name() + ": " + pp.name() + ": " + err));
            }
        }
        return warnings;
    }

    /**
     * Runs the builder, then feeds its artifact through the post-processors in order. An
     * intermediate artifact is kept only when the post-processor that consumed it asks to.
     *
     * @return the artifacts kept; empty when the builder produced none
     */
    public List<Artifact> run(Ui ui, Cache cache) {
        log.debug("Starting build {}", getName());
        Artifact artifact = builder.component().run(ui, hook, cache);
        if (artifact == null) {
            ui.say("Build '" + getName() + "' finished but did not generate an artifact.");
            return List.of();
        }
        List<Artifact> kept = new ArrayList<>();
        for (Named<PostProcessor> pp : postProcessors) {
            if (cancelled) {
                kept.add(artifact);
                return kept;
            }
            ui.say("Running post-processor: " + pp.name());
            PostProcessResult result = pp.component().postProcess(ui, artifact);
            if (result.keepOriginal()) {
                kept.add(artifact);
            } else {
                ui.message("Deleting original artifact for build '" + getName() + "'");
            }
            artifact = result.artifact();
        }
        kept.add(artifact);
        return kept;
    }

    /**
     * Cancels the builder and whatever provisioner or hook it is running. The builder is cancelled
     * even when cancelling the hook fails.
     */
    public void cancel() {
        cancelled = true;
        try {
            hook.cancel();
        } finally {
            builder.component().cancel();
        }
    }
}
