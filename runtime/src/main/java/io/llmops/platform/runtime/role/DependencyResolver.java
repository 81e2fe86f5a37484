package io.llmops.platform.runtime.role;

import io.llmops.platform.runtime.config.ConfigException;
import io.llmops.platform.runtime.instance.StartException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves what a role needs before it starts: launcher executables on the
 * search path, and well-formed dependency version constraints.
 *
 * <p>Installing dependencies is left to the deployment; only the constraint
 * syntax is checked here.</p>
 */
public class DependencyResolver {

    private static final String VERSION = "[A-Za-z0-9.*+!_-]+";
    private static final String OPERATOR = "(?:===|==|>=|<=|~=|!=|>|<)";
    private static final Pattern CONSTRAINT = Pattern.compile(
            "^[A-Za-z0-9](?:[A-Za-z0-9._-]*[A-Za-z0-9])?"
                    + "(?:\\[[A-Za-z0-9._-]+(?:\\s*,\\s*[A-Za-z0-9._-]+)*])?"
                    + "(?:\\s*" + OPERATOR + "\\s*" + VERSION
                    + "(?:\\s*,\\s*" + OPERATOR + "\\s*" + VERSION + ")*)?$");

    private final List<Path> searchPath;

    /**
     * Create a resolver over an explicit search path.
     *
     * @param searchPath directories searched for executables, in order
     */
    public DependencyResolver(@Nonnull List<Path> searchPath) {
        this.searchPath = List.copyOf(searchPath);
    }

    /**
     * Create a resolver over a {@code PATH}-style string.
     *
     * @param path directories separated by the platform path separator, may be null
     * @return the resolver
     */
    @Nonnull
    public static DependencyResolver fromPath(@Nullable String path) {
        List<Path> directories = new ArrayList<>();
        if (path != null) {
            for (String entry : path.split(Pattern.quote(File.pathSeparator))) {
                if (!entry.isBlank()) {
                    directories.add(Path.of(entry));
                }
            }
        }
        return new DependencyResolver(directories);
    }

    /**
     * Find an executable on the search path.
     *
     * @param name executable name
     * @return its path, or empty
     */
    @Nonnull
    public Optional<Path> findExecutable(@Nonnull String name) {
        for (Path directory : searchPath) {
            Path candidate = directory.resolve(name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Require an executable on the search path.
     *
     * @param name executable name
     * @return its path
     * @throws StartException with {@code DEPENDENCY_UNRESOLVED} if not found
     */
    @Nonnull
    public Path requireExecutable(@Nonnull String name) throws StartException {
        return findExecutable(name).orElseThrow(() -> new StartException(
                StartException.Reason.DEPENDENCY_UNRESOLVED,
                "executable '" + name + "' not found on PATH"));
    }

    /**
     * Check that every declared dependency is a well-formed requirement such
     * as {@code flask}, {@code flask==2.3.2} or {@code torch>=2.0,<3}.
     *
     * @param dependencies declared dependencies
     * @throws ConfigException naming the first malformed entry
     */
    public static void checkConstraints(@Nonnull List<String> dependencies) throws ConfigException {
        for (int i = 0; i < dependencies.size(); i++) {
            String dependency = dependencies.get(i);
            if (dependency == null || !CONSTRAINT.matcher(dependency.trim()).matches()) {
                throw ConfigException.invalid("dependencies[" + i + "]",
                        "not a valid version constraint: '" + dependency + "'");
            }
        }
    }

    @Nonnull
    public List<Path> getSearchPath() {
        return searchPath;
    }
}
