package com.kiln.internal.components.command;

import com.kiln.component.Artifact;
import com.kiln.component.Command;
import com.kiln.component.CommandContext;
import com.kiln.component.error.ConfigException;
import com.kiln.component.error.ValidationException;
import com.kiln.config.KilnConfig;
import com.kiln.environment.CancellationToken;
import com.kiln.environment.Environment;
import com.kiln.environment.build.BuildResult;
import com.kiln.environment.build.BuildRunner;
import com.kiln.environment.build.BuildTemplate;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code kiln build [-parallel-builds=N] <file>}: prepares every build of a build description,
 * runs them concurrently and reports the artifacts. Exits 1 if any build failed.
 */
public final class BuildCommand implements Command {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    static final String PARALLEL_FLAG = "-parallel-builds=";

    @Override
    public int run(CommandContext context, List<String> args) {
        Ui ui = context.ui();
        int parallelism = KilnConfig.fromEnvironment().getBuildParallelism();
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith(PARALLEL_FLAG)) {
                try {
                    parallelism = Integer.parseInt(arg.substring(PARALLEL_FLAG.length()));
                } catch (NumberFormatException e) {
                    ui.error("Invalid value for -parallel-builds: " + arg.substring(PARALLEL_FLAG.length()));
                    return 1;
                }
            } else if (arg.startsWith("-")) {
                ui.error("Unknown flag: " + arg + "\n\n" + help());
                return 1;
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() != 1) {
            ui.error(help());
            return 1;
        }

        BuildTemplate template;
        try {
            template = BuildTemplate.read(Path.of(positional.get(0)));
        } catch (ConfigException e) {
            ui.error("Failed to parse build description:\n" + e.getMessage());
            return 1;
        }
        BuildRunner runner = new BuildRunner(context.components(), parallelism);
        BuildRunner.Prepared prepared;
        try {
            prepared = runner.prepare(template);
        } catch (ValidationException e) {
            ui.error(e.getMessage());
            return 1;
        }
        if (!prepared.warnings().isEmpty()) {
            ui.say("Warnings for build:\n  " + String.join("\n  ", prepared.warnings()));
        }

        CancellationToken token = context instanceof Environment env ? env.cancellation() : new CancellationToken();
        log.debug("Running {} builds with parallelism {}", prepared.builds().size(), parallelism);
        List<BuildResult> results = runner.run(prepared.builds(), ui, context.cache(), token);
        return report(ui, results);
    }

    private static int report(Ui ui, List<BuildResult> results) {
        boolean failed = false;
        for (BuildResult r : results) {
            if (!r.succeeded()) {
                if (!failed) {
                    ui.error("Some builds didn't complete successfully and had errors:");
                    failed = true;
                }
                ui.error("--> " + r.name() + ": " + r.error());
                ui.machine("error-count", r.name(), "1");
            }
        }
        ui.say("Builds finished. The artifacts of successful builds are:");
        for (BuildResult r : results) {
            if (!r.succeeded()) {
                continue;
            }
            if (r.artifacts().isEmpty()) {
                ui.message("--> " + r.name() + ": (no artifacts)");
            }
            ui.machine("artifact-count", r.name(), String.valueOf(r.artifacts().size()));
            int i = 0;
            for (Artifact a : r.artifacts()) {
                ui.message("--> " + r.name() + ": " + a);
                ui.machine("artifact", r.name(), String.valueOf(i), "builder-id", a.builderId());
                ui.machine("artifact", r.name(), String.valueOf(i), "id", a.id());
                i++;
            }
        }
        return failed ? 1 : 0;
    }

    @Override
    public String help() {
        return "Usage: kiln build [options] <file>\n\n"
                + "  Runs every build in the build description file and reports the artifacts.\n\n"
                + "Options:\n\n"
                + "  -parallel-builds=N  Run at most N builds at once (0 for no limit)";
    }

    @Override
    public String synopsis() {
        return "Builds images from a build description";
    }
}
