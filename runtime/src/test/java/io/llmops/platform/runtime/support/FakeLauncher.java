package io.llmops.platform.runtime.support;

import io.llmops.platform.runtime.process.ProcessLauncher;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records launch requests and hands out {@link FakeProcess}es.
 */
public class FakeLauncher implements ProcessLauncher {

    private final List<LaunchRequest> requests = new CopyOnWriteArrayList<>();
    private final List<FakeProcess> processes = new CopyOnWriteArrayList<>();

    private volatile Integer crashCode;
    private volatile String crashOutput;
    private volatile IOException launchFailure;

    /**
     * Make the next launches exit at once with the given code after writing
     * {@code output} to their log.
     */
    public void crashWith(int code, String output) {
        this.crashCode = code;
        this.crashOutput = output;
    }

    public void failWith(IOException failure) {
        this.launchFailure = failure;
    }

    @Nonnull
    @Override
    public Process launch(@Nonnull LaunchRequest request) throws IOException {
        requests.add(request);
        if (launchFailure != null) {
            throw launchFailure;
        }
        Path logFile = request.logFile();
        Files.createDirectories(logFile.toAbsolutePath().getParent());
        FakeProcess process;
        if (crashCode != null) {
            Files.writeString(logFile, crashOutput, StandardCharsets.UTF_8);
            process = FakeProcess.exited(crashCode);
        } else {
            Files.writeString(logFile, "started " + String.join(" ", request.command()) + "\n", StandardCharsets.UTF_8);
            process = new FakeProcess();
        }
        processes.add(process);
        return process;
    }

    public List<LaunchRequest> getRequests() {
        return requests;
    }

    public LaunchRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public List<FakeProcess> getProcesses() {
        return processes;
    }

    public FakeProcess lastProcess() {
        return processes.get(processes.size() - 1);
    }
}
