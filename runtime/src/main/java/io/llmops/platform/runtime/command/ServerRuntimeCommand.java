package io.llmops.platform.runtime.command;

import io.llmops.platform.runtime.Action;
import io.llmops.platform.runtime.ErrorCode;
import io.llmops.platform.runtime.OrchestrationException;
import io.llmops.platform.runtime.Orchestrator;
import io.llmops.platform.runtime.RoleStatusReport;
import io.llmops.platform.runtime.instance.LifecycleStatus;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import javax.annotation.Nonnull;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Command line adapter over the {@link Orchestrator}.
 *
 * <p>Usage:</p>
 * <ul>
 *   <li>{@code server-runtime web} - Start the web role</li>
 *   <li>{@code server-runtime -A status loadbalancer} - Pool and status of the load balancer</li>
 *   <li>{@code server-runtime -A stop monitoring} - Stop the monitoring role and its alert loop</li>
 *   <li>{@code server-runtime --no-attach loadbalancer} - Start without hosting the health checks</li>
 * </ul>
 *
 * <p>Prints one status or error line and exits with the code of the
 * {@link ErrorCode}. Starting the load balancer or monitoring role attached
 * keeps the command in the foreground running their loops until it is
 * terminated.</p>
 */
@Command(
        name = "server-runtime",
        description = "Start, stop or query one server role of the platform",
        mixinStandardHelpOptions = true,
        version = "server-runtime 1.0.0",
        exitCodeOnInvalidInput = 64
)
public class ServerRuntimeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRuntimeCommand.class);

    /**
     * Creates the orchestrator of one invocation.
     */
    @FunctionalInterface
    public interface OrchestratorFactory {
        @Nonnull
        Orchestrator create(@Nonnull Path configDirectory, @Nonnull Path applicationDirectory, boolean attached);
    }

    @Spec
    CommandSpec spec;

    @Parameters(
            index = "0",
            paramLabel = "ROLE",
            description = "Role to act on: web, api, loadbalancer, database, monitoring"
    )
    String role;

    @Option(
            names = {"-c", "--config-dir"},
            paramLabel = "DIR",
            defaultValue = "./configs",
            description = "Directory holding <role>_server.json (default: ${DEFAULT-VALUE})"
    )
    Path configDirectory;

    @Option(
            names = {"-a", "--app-dir"},
            paramLabel = "DIR",
            defaultValue = "${env:APP_DIR:-/mnt/nfs/apps/current}",
            description = "Application directory (default: $APP_DIR or /mnt/nfs/apps/current)"
    )
    Path applicationDirectory;

    @Option(
            names = {"-A", "--action"},
            paramLabel = "ACTION",
            defaultValue = "start",
            description = "start, stop or status (default: ${DEFAULT-VALUE})"
    )
    String action;

    @Option(
            names = "--attach",
            negatable = true,
            defaultValue = "true",
            fallbackValue = "true",
            description = "Stay in the foreground running the role's background loops (default: true)"
    )
    boolean attach;

    private final OrchestratorFactory factory;

    public ServerRuntimeCommand() {
        this((configDirectory, applicationDirectory, attached) ->
                Orchestrator.builder(configDirectory, applicationDirectory)
                        .hostingLoops(attached)
                        .build());
    }

    public ServerRuntimeCommand(@Nonnull OrchestratorFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Orchestrator orchestrator = factory.create(configDirectory, applicationDirectory, attach);
        RoleStatusReport report;
        try {
            report = orchestrator.execute(role, action);
        } catch (OrchestrationException e) {
            LOGGER.debug("Invocation failed", e);
            err.println(e.toErrorLine());
            err.flush();
            return e.getCode().getExitCode();
        }
        out.println(report.summary());
        out.flush();

        if (attach && Action.byName(action) == Action.START && report.role().hasBackgroundLoop()) {
            return runAttached(orchestrator, report.role(), err);
        }
        return ErrorCode.OK.getExitCode();
    }

    private int runAttached(Orchestrator orchestrator, Role role, PrintWriter err) {
        Runtime.getRuntime().addShutdownHook(new Thread(orchestrator::shutdown, "ServerRuntime-Shutdown"));
        LOGGER.info("Running background loops of role '{}' until terminated", role);

        LifecycleStatus last;
        try {
            last = orchestrator.awaitTermination(role);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.shutdown();
            return ErrorCode.OK.getExitCode();
        }
        if (last == LifecycleStatus.STOPPED || orchestrator.isShutdown()) {
            return ErrorCode.OK.getExitCode();
        }

        orchestrator.shutdown();
        OrchestrationException failure = new OrchestrationException(ErrorCode.START_FAILED,
                role.getRoleName(), Action.START.getActionName(), "role exited unexpectedly (" + last + ")");
        err.println(failure.toErrorLine());
        err.flush();
        return failure.getCode().getExitCode();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ServerRuntimeCommand()).execute(args);
        System.exit(exitCode);
    }
}
