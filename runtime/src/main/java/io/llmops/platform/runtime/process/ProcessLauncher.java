package io.llmops.platform.runtime.process;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Starts OS processes on behalf of the supervisor.
 */
@FunctionalInterface
public interface ProcessLauncher {

    /**
     * Start a process.
     *
     * @param request what to run
     * @return the started process
     * @throws IOException if the process could not be started
     */
    @Nonnull
    Process launch(@Nonnull LaunchRequest request) throws IOException;

    /**
     * A process to start.
     *
     * @param command executable and arguments
     * @param workingDirectory working directory
     * @param environment variables added to the inherited environment
     * @param logFile file receiving the combined stdout and stderr
     */
    record LaunchRequest(
            List<String> command,
            Path workingDirectory,
            Map<String, String> environment,
            Path logFile
    ) {
        public LaunchRequest {
            Objects.requireNonNull(workingDirectory, "workingDirectory");
            Objects.requireNonNull(logFile, "logFile");
            command = List.copyOf(command);
            environment = Map.copyOf(environment);
            if (command.isEmpty()) {
                throw new IllegalArgumentException("command must not be empty");
            }
        }
    }
}
