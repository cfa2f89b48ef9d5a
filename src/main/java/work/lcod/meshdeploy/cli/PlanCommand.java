package work.lcod.meshdeploy.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import picocli.CommandLine;
import work.lcod.meshdeploy.api.DeployPlanner;
import work.lcod.meshdeploy.api.LogLevel;
import work.lcod.meshdeploy.api.OutputFormat;
import work.lcod.meshdeploy.api.PlanConfiguration;
import work.lcod.meshdeploy.api.PlanResult;
import work.lcod.meshdeploy.compat.Warning;

@CommandLine.Command(
    name = "mesh-plan",
    description = "Check a compose project for unsupported keys and resolve its secrets.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PlanCommand implements Callable<Integer> {
    static final String LOG_LEVEL_ENV = "MESHDEPLOY_LOG_LEVEL";
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--file"},
        required = true,
        description = "Compose project file."
    )
    private Path projectFile;

    @CommandLine.Option(
        names = "--project-name",
        description = "Override the project name.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String projectName;

    @CommandLine.Option(
        names = "--working-dir",
        description = "Directory relative secret files resolve against (default: the project file's directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path workingDirectory;

    @CommandLine.Option(
        names = {"-s", "--service"},
        split = ",",
        description = "Only plan these services (repeatable, comma separated)."
    )
    private List<String> services = new ArrayList<>();

    @CommandLine.Option(
        names = "--format",
        description = "Output format (text|json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String formatRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private final Function<String, String> environment;

    PlanCommand() {
        this(System::getenv);
    }

    PlanCommand(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        Path file = projectFile.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Project file not found: " + projectFile);
        }

        PlanDefaults defaults;
        LogLevel logLevel;
        OutputFormat format;
        try {
            defaults = PlanDefaults.load(file.getParent());
            logLevel = resolveLogLevel(defaults);
            format = OutputFormat.from(firstNonBlank(formatRaw, defaults.format().orElse(null)));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        // Must happen before the first logger is created.
        System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerLevel());

        var configuration = PlanConfiguration.builder()
            .projectFile(file)
            .workingDirectory(Optional.ofNullable(workingDirectory).map(path -> path.toAbsolutePath().normalize()))
            .projectName(Optional.ofNullable(firstNonBlank(projectName, defaults.projectName().orElse(null))))
            .services(services.isEmpty() ? defaults.services() : services)
            .outputFormat(format)
            .logLevel(logLevel)
            .build();

        PlanResult result = new DeployPlanner().run(configuration);
        if (format == OutputFormat.JSON) {
            spec.commandLine().getOut().println(result.toPrettyJson());
        } else {
            printText(result);
        }
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel(PlanDefaults defaults) {
        return LogLevel.from(firstNonBlank(
            logLevelRaw,
            environment.apply(LOG_LEVEL_ENV),
            defaults.logLevel().orElse(null)
        ));
    }

    @SuppressWarnings("unchecked")
    private void printText(PlanResult result) {
        PrintWriter out = spec.commandLine().getOut();
        var metadata = result.metadata();
        if (result.status() == PlanResult.Status.FAILURE) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + metadata.get("error"));
            err.flush();
            return;
        }
        for (var warning : (List<Map<String, Object>>) metadata.get("warnings")) {
            var rendered = new Warning(
                (String) warning.get("service"),
                (String) warning.get("key"),
                (String) warning.get("message")
            );
            out.println("WARNING: " + rendered);
        }
        for (var service : (List<Map<String, Object>>) metadata.get("services")) {
            for (var mount : (List<Map<String, Object>>) service.get("mounts")) {
                out.println(describeMount((String) service.get("service"), mount));
            }
        }
    }

    static String describeMount(String service, Map<String, Object> mount) {
        var line = new StringBuilder()
            .append(service)
            .append(": secret ")
            .append(mount.get("secret"))
            .append(" -> ")
            .append(mount.getOrDefault("path", "(default)"));
        var details = new ArrayList<String>();
        if (mount.containsKey("uid")) {
            details.add("uid " + mount.get("uid"));
        }
        if (mount.containsKey("gid")) {
            details.add("gid " + mount.get("gid"));
        }
        if (mount.containsKey("mode")) {
            details.add("mode " + mount.get("mode"));
        }
        if (!details.isEmpty()) {
            line.append(" (").append(String.join(", ", details)).append(')');
        }
        return line.toString();
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate;
            }
        }
        return null;
    }
}
