package io.llmops.platform.runtime.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ServiceController} backed by {@code systemctl}.
 */
public class SystemctlServiceController implements ServiceController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemctlServiceController.class);

    private final List<String> commandPrefix;
    private final Duration timeout;

    /**
     * Create a controller running plain {@code systemctl} with a 60 second timeout.
     */
    public SystemctlServiceController() {
        this(List.of("systemctl"), Duration.ofSeconds(60));
    }

    /**
     * Create a controller.
     *
     * @param commandPrefix command used to reach systemctl, e.g. {@code [sudo, systemctl]}
     * @param timeout how long a single systemctl call may take
     */
    public SystemctlServiceController(@Nonnull List<String> commandPrefix, @Nonnull Duration timeout) {
        this.commandPrefix = List.copyOf(Objects.requireNonNull(commandPrefix, "commandPrefix"));
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public boolean isActive(@Nonnull String unit) throws IOException {
        return run("is-active", "--quiet", unit) == 0;
    }

    @Override
    public void start(@Nonnull String unit) throws IOException {
        check(unit, "start", run("start", unit));
    }

    @Override
    public void stop(@Nonnull String unit) throws IOException {
        check(unit, "stop", run("stop", unit));
    }

    @Override
    public void restart(@Nonnull String unit) throws IOException {
        check(unit, "restart", run("restart", unit));
    }

    @Override
    public void reload(@Nonnull String unit) throws IOException {
        check(unit, "reload", run("reload", unit));
    }

    private static void check(String unit, String verb, int exitCode) throws IOException {
        if (exitCode != 0) {
            throw new IOException("systemctl " + verb + " " + unit + " exited with code " + exitCode);
        }
    }

    private int run(String... arguments) throws IOException {
        List<String> command = new ArrayList<>(commandPrefix);
        command.addAll(List.of(arguments));
        LOGGER.debug("Command: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Timed out after " + timeout.toSeconds() + "s: " + String.join(" ", command));
            }
            try (InputStream output = process.getInputStream()) {
                String text = new String(output.readAllBytes(), StandardCharsets.UTF_8).trim();
                if (!text.isEmpty()) {
                    LOGGER.debug("{}: {}", String.join(" ", command), text);
                }
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running " + String.join(" ", command), e);
        }
    }
}
