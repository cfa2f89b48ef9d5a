package work.lcod.meshdeploy.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Defaults read from the optional {@code meshdeploy.toml} next to the project file:
 *
 * <pre>
 * [plan]
 * project_name = "shop"
 * format = "json"
 * log_level = "info"
 * services = ["web", "worker"]
 * </pre>
 */
record PlanDefaults(Optional<String> projectName, Optional<String> format, Optional<String> logLevel, List<String> services) {
    static final String FILE_NAME = "meshdeploy.toml";

    PlanDefaults {
        services = List.copyOf(services);
    }

    static PlanDefaults none() {
        return new PlanDefaults(Optional.empty(), Optional.empty(), Optional.empty(), List.of());
    }

    static PlanDefaults load(Path directory) {
        if (directory == null) {
            return none();
        }
        Path file = directory.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return none();
        }
        TomlParseResult result;
        try {
            result = Toml.parse(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read " + file + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid " + file + ": " + errors);
        }
        TomlTable plan = result.getTable("plan");
        if (plan == null) {
            return none();
        }
        try {
            return new PlanDefaults(
                Optional.ofNullable(plan.getString("project_name")),
                Optional.ofNullable(plan.getString("format")),
                Optional.ofNullable(plan.getString("log_level")),
                stringList(plan.getArray("services"))
            );
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> stringList(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        var values = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
