package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.config.DatabaseSpec;
import io.llmops.platform.runtime.config.RoleConfig;
import io.llmops.platform.runtime.instance.ServerInstance;
import io.llmops.platform.runtime.instance.StartException;
import io.llmops.platform.runtime.process.MarkerOsHandle;
import io.llmops.platform.runtime.process.OsHandle;
import io.llmops.platform.runtime.process.ProcessSupervisor;
import io.llmops.platform.runtime.process.ServiceOsHandle;
import io.llmops.platform.runtime.registry.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * The application database: an SQLite file under the data directory, or
 * the host's PostgreSQL service.
 *
 * <p>Starting never recreates or truncates existing data. SQLite has no
 * long-lived process, so its handle is an activation marker under the run
 * directory.</p>
 */
public class DatabaseRole extends AbstractRoleLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseRole.class);

    static final String POSTGRES_SERVICE = "postgresql";
    static final String MARKER_FILE = "database.active";
    static final String DATABASE_URL = "DATABASE_URL";

    public DatabaseRole(@Nonnull RoleContext context) {
        super(Role.DATABASE, context);
    }

    @Override
    public void validate(@Nonnull RoleConfig config) throws ConfigException {
        checkCommon(config);
        DatabaseSpec spec = DatabaseSpec.from(config);
        if (spec.engine() == DatabaseSpec.Engine.SQLITE && Files.exists(spec.dataDirectory())
                && !Files.isDirectory(spec.dataDirectory())) {
            throw ConfigException.invalid("data_dir", spec.dataDirectory() + " exists and is not a directory");
        }
    }

    @Nonnull
    @Override
    public RoleInstance start(@Nonnull RoleConfig config) throws StartException {
        Objects.requireNonNull(config, "config");
        DatabaseSpec spec;
        try {
            spec = DatabaseSpec.from(config);
        } catch (ConfigException e) {
            throw invalidAtStart(e);
        }

        ProcessSupervisor supervisor = context.getSupervisor();
        RoleInstance instance = begin(config);
        ServerInstance server = instance.getServer();
        StartRollback rollback = new StartRollback(role);
        try {
            OsHandle handle = spec.engine() == DatabaseSpec.Engine.SQLITE
                    ? startSqlite(spec, rollback)
                    : startPostgres(config, rollback);
            server.attach(handle);

            server.setDetail("db_type", spec.engine().name().toLowerCase(Locale.ROOT));
            server.setDetail(DATABASE_URL, spec.connectionUrl());
            supervisor.register(role, handle, spec.port(), server.getDetails(), null);
            LOGGER.info("Database configured: {}", spec.redactedUrl());
        } catch (StartException e) {
            throw fail(instance, rollback, e);
        }
        complete(instance, rollback);
        return instance;
    }

    private OsHandle startSqlite(DatabaseSpec spec, StartRollback rollback) throws StartException {
        Path file = spec.sqliteFile();
        try {
            rollback.createDirectories(spec.dataDirectory());
            if (Files.exists(file)) {
                LOGGER.info("Using existing SQLite database {}", file);
            } else {
                Files.createFile(file);
                rollback.add("delete " + file, () -> Files.deleteIfExists(file));
                LOGGER.info("Created SQLite database {}", file);
            }
        } catch (IOException e) {
            throw resourceFailure("initialise SQLite database " + file, e);
        }

        Path marker = context.getSupervisor().getStore().getRunDirectory().resolve(MARKER_FILE);
        MarkerOsHandle handle = context.getSupervisor().activateMarker(role, marker);
        rollback.add("remove " + handle.describe(), () -> handle.terminate(Duration.ZERO));
        return handle;
    }

    private OsHandle startPostgres(RoleConfig config, StartRollback rollback) throws StartException {
        ProcessSupervisor supervisor = context.getSupervisor();
        ServiceOsHandle handle = supervisor.startService(role, POSTGRES_SERVICE, false);
        if (handle.isStartedHere()) {
            rollback.add("stop " + handle.describe(), () -> supervisor.release(handle, config.getShutdownTimeout()));
        }
        return handle;
    }
}
