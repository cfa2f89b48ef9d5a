package work.lcod.meshdeploy.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one planning run.
 */
public record PlanConfiguration(
    Path projectFile,
    Optional<Path> workingDirectory,
    Optional<String> projectName,
    List<String> services,
    OutputFormat outputFormat,
    LogLevel logLevel
) {
    public PlanConfiguration {
        Objects.requireNonNull(projectFile, "projectFile");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(projectName, "projectName");
        services = services == null ? List.of() : List.copyOf(services);
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path projectFile;
        private Optional<Path> workingDirectory = Optional.empty();
        private Optional<String> projectName = Optional.empty();
        private List<String> services = List.of();
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder projectFile(Path projectFile) {
            this.projectFile = projectFile;
            return this;
        }

        public Builder workingDirectory(Optional<Path> workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder projectName(Optional<String> projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder services(List<String> services) {
            this.services = services;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public PlanConfiguration build() {
            return new PlanConfiguration(projectFile, workingDirectory, projectName, services, outputFormat, logLevel);
        }
    }
}
