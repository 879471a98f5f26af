package com.kiln.cli;

import com.kiln.cache.FileCache;
import com.kiln.config.KilnConfig;
import com.kiln.environment.CancellationToken;
import com.kiln.environment.Environment;
import com.kiln.environment.EnvironmentConfig;
import com.kiln.internal.components.InternalComponents;
import com.kiln.plugin.ComponentRegistry;
import com.kiln.ui.BasicUi;
import com.kiln.ui.MachineReadableUi;
import com.kiln.ui.Ui;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Kiln command line entry point. Wires configuration, UI, cache and the component registry into
 * an {@link Environment} and exits with the command's status.
 * <p>
 * On Ctrl+C the shutdown hook cancels the running command and waits for plugin cleanup.
 */
public final class KilnMain {

    private static final Logger log = LoggerFactory.getLogger(KilnMain.class);

    static final String MACHINE_READABLE_FLAG = "-machine-readable";
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private KilnMain() {
    }

    /** Arguments with the UI selection flag taken out. */
    record Invocation(boolean machineReadable, List<String> args) {
    }

    public static void main(String[] args) {
        System.exit(run(Arrays.asList(args)));
    }

    static Invocation parse(List<String> args) {
        boolean machineReadable = false;
        List<String> rest = new ArrayList<>(args.size());
        for (String arg : args) {
            if (MACHINE_READABLE_FLAG.equals(arg)) {
                machineReadable = true;
            } else {
                rest.add(arg);
            }
        }
        return new Invocation(machineReadable, List.copyOf(rest));
    }

    static int run(List<String> args) {
        Invocation invocation = parse(args);
        Ui ui = invocation.machineReadable() ? new MachineReadableUi(System.out) : BasicUi.standard();

        KilnConfig config;
        try {
            config = KilnConfig.fromEnvironment();
        } catch (IllegalArgumentException e) {
            ui.error("Invalid Kiln configuration: " + e.getMessage());
            return 1;
        }
        log.debug("Plugin search path: {}", config.getPluginSearchPath());

        ComponentRegistry registry = InternalComponents.registerAll(ComponentRegistry.builder(config)).build();
        Environment environment = new Environment(EnvironmentConfig.builder()
                .ui(ui)
                .cache(new FileCache(config.getCacheDir().toAbsolutePath()))
                .registry(registry)
                .build());

        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            log.info("Interrupted, cancelling and cleaning up plugins...");
            token.cancel();
            try {
                if (!finished.await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Cleanup did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "kiln-shutdown"));

        try {
            return environment.cli(invocation.args(), token);
        } finally {
            finished.countDown();
        }
    }
}
