package com.kiln.environment.build;

import com.kiln.cache.Cache;
import com.kiln.component.Builder;
import com.kiln.component.ComponentLoader;
import com.kiln.component.Hook;
import com.kiln.component.PostProcessor;
import com.kiln.component.Provisioner;
import com.kiln.component.error.ComponentNotFoundException;
import com.kiln.component.error.ValidationException;
import com.kiln.environment.CancellationToken;
import com.kiln.ui.TargetedUi;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Turns a {@link BuildTemplate} into builds, prepares them all, and runs them concurrently.
 */
public final class BuildRunner {

    private static final Logger log = LoggerFactory.getLogger(BuildRunner.class);

    private final ComponentLoader loader;
    private final int parallelism;

    /**
     * @param parallelism maximum builds running at once; 0 or less for no limit
     */
    public BuildRunner(ComponentLoader loader, int parallelism) {
        this.loader = loader;
        this.parallelism = parallelism;
    }

    /** Prepared builds and the warnings their builders reported. */
    public record Prepared(List<Build> builds, List<String> warnings) {
    }

    /**
     * Loads and prepares every build of {@code template}.
     *
     * @throws ValidationException with one entry per problem across all builds
     */
    public Prepared prepare(BuildTemplate template) {
        List<String> errors = new ArrayList<>();
        List<Build> builds = new ArrayList<>();
        for (BuildTemplate.ComponentSpec spec : template.getBuilders()) {
            Build build = load(template, spec, errors);
            if (build != null) {
                builds.add(build);
            }
        }
        List<String> warnings = new ArrayList<>();
        for (Build build : builds) {
            build.prepare(errors).forEach(w -> warnings.add(build.getName() + ": " + w));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new Prepared(builds, warnings);
    }

    private Build load(BuildTemplate template, BuildTemplate.ComponentSpec spec, List<String> errors) {
        int before = errors.size();
        Builder builder = tryLoad(() -> loader.builder(spec.type()), spec.name(), errors);
        List<Build.Named<Provisioner>> provisioners = new ArrayList<>();
        for (BuildTemplate.ComponentSpec p : template.getProvisioners()) {
            Provisioner provisioner = tryLoad(() -> loader.provisioner(p.type()), spec.name(), errors);
            if (provisioner != null) {
                provisioners.add(new Build.Named<>(p.name(), provisioner, p.config()));
            }
        }
        List<Build.Named<PostProcessor>> postProcessors = new ArrayList<>();
        for (BuildTemplate.ComponentSpec pp : template.getPostProcessors()) {
            PostProcessor postProcessor = tryLoad(() -> loader.postProcessor(pp.type()), spec.name(), errors);
            if (postProcessor != null) {
                postProcessors.add(new Build.Named<>(pp.name(), postProcessor, pp.config()));
            }
        }
        Map<String, List<Hook>> hooks = new LinkedHashMap<>();
        template.getHooks().forEach((hookName, types) -> {
            List<Hook> loaded = new ArrayList<>();
            for (String type : types) {
                Hook hook = tryLoad(() -> loader.hook(type), spec.name(), errors);
                if (hook != null) {
                    loaded.add(hook);
                }
            }
            hooks.put(hookName, loaded);
        });
        if (errors.size() > before || builder == null) {
            return null;
        }
        return new Build(new Build.Named<>(spec.name(), builder, spec.config()), provisioners, postProcessors, hooks);
    }

    private static <T> T tryLoad(Supplier<T> loader, String buildName, List<String> errors) {
        try {
            return loader.get();
        } catch (ComponentNotFoundException e) {
            errors.add(buildName + ": " + e.getMessage());
            return null;
        }
    }

    /**
     * Runs every build, each with its own targeted UI. A failing build is reported and does not
     * stop the others. Cancelling {@code token} cancels all running builds.
     */
    public List<BuildResult> run(List<Build> builds, Ui ui, Cache cache, CancellationToken token) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "kiln-build-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = parallelism > 0
                ? Executors.newFixedThreadPool(parallelism, threads)
                : Executors.newCachedThreadPool(threads);
        CancellationToken.Registration registration = token.onCancel(() -> cancelAll(builds));
        try {
            List<Future<BuildResult>> futures = new ArrayList<>();
            for (Build build : builds) {
                futures.add(executor.submit(() -> runOne(build, TargetedUi.of(ui, build.getName()), cache, token)));
            }
            List<BuildResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), builds.get(i).getName()));
            }
            return results;
        } finally {
            registration.close();
            executor.shutdownNow();
        }
    }

    private static void cancelAll(List<Build> builds) {
        for (Build build : builds) {
            try {
                build.cancel();
            } catch (RuntimeException e) {
                log.warn("Failed to cancel build {}: {}", build.getName(), e.getMessage(), e);
            }
        }
    }

    private static BuildResult runOne(Build build, Ui ui, Cache cache, CancellationToken token) {
        if (token.isCancelled()) {
            return new BuildResult(build.getName(), List.of(), "Build was cancelled");
        }
        try {
            return new BuildResult(build.getName(), build.run(ui, cache), null);
        } catch (RuntimeException e) {
            log.debug("Build {} failed", build.getName(), e);
            ui.error("Build '" + build.getName() + "' errored: " + e.getMessage());
            return new BuildResult(build.getName(), List.of(), e.getMessage());
        }
    }

    private static BuildResult await(Future<BuildResult> future, String name) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BuildResult(name, List.of(), "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("Build {} failed unexpectedly: {}", name, cause.toString(), cause);
            return new BuildResult(name, List.of(), String.valueOf(cause.getMessage()));
        }
    }
}
