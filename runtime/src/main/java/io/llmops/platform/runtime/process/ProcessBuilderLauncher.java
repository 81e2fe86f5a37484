package io.llmops.platform.runtime.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Launches processes with {@link ProcessBuilder}.
 *
 * <p>Output goes straight to the log file rather than through a pipe, so the
 * child keeps running after the launching runtime exits.</p>
 */
public class ProcessBuilderLauncher implements ProcessLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessBuilderLauncher.class);

    @Nonnull
    @Override
    public Process launch(@Nonnull LaunchRequest request) throws IOException {
        if (!Files.isDirectory(request.workingDirectory())) {
            throw new IOException("Working directory does not exist: " + request.workingDirectory());
        }
        Files.createDirectories(request.logFile().toAbsolutePath().getParent());

        LOGGER.debug("Command: {}", String.join(" ", request.command()));

        ProcessBuilder builder = new ProcessBuilder(request.command());
        builder.directory(request.workingDirectory().toFile());
        builder.redirectErrorStream(true);
        builder.redirectOutput(ProcessBuilder.Redirect.appendTo(request.logFile().toFile()));
        builder.environment().putAll(request.environment());

        Process process = builder.start();
        process.getOutputStream().close();
        return process;
    }
}
