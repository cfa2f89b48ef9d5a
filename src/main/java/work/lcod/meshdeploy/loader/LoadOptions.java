package work.lcod.meshdeploy.loader;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Overrides applied while loading a project file.
 *
 * @param workingDirectory base directory for relative secret files (default: the project file's directory)
 * @param projectName explicit project name (default: the file's {@code name}, then the directory name)
 * @param environment variables used to fill {@code environment:}-backed secrets
 */
public record LoadOptions(Optional<Path> workingDirectory, Optional<String> projectName, Map<String, String> environment) {
    public LoadOptions {
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(projectName, "projectName");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static LoadOptions defaults() {
        return new LoadOptions(Optional.empty(), Optional.empty(), System.getenv());
    }

    public LoadOptions withWorkingDirectory(Path directory) {
        return new LoadOptions(Optional.ofNullable(directory), projectName, environment);
    }

    public LoadOptions withProjectName(String name) {
        return new LoadOptions(workingDirectory, Optional.ofNullable(name), environment);
    }

    public LoadOptions withEnvironment(Map<String, String> variables) {
        return new LoadOptions(workingDirectory, projectName, variables);
    }
}
