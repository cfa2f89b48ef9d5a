package work.lcod.meshdeploy.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class PlanCommandTest {
    private static final Path PROJECTS = Path.of("src", "test", "resources", "projects").toAbsolutePath();
    private static final String SHOP = PROJECTS.resolve("shop").resolve("compose.yaml").toString();

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsWarningsAndMountsAsText() {
        int exitCode = run(Map.of(), "-f", SHOP, "--log-level", "error");

        assertEquals(0, exitCode, err::toString);
        String output = out.toString();
        assertTrue(output.contains(
            "WARNING: service 'web': 'restart' is not supported. Container lifecycle is managed automatically."), output);
        assertTrue(output.contains("WARNING: service 'worker': 'secrets' is not supported."), output);
        assertTrue(output.contains("web: secret api_key -> /run/secrets/api_key"), output);
        assertTrue(output.contains("web: secret db_password -> /etc/app/db_password (uid 1000, gid 1000, mode 0400)"), output);
        assertTrue(output.indexOf("WARNING:") < output.indexOf("web: secret"), output);
    }

    @Test
    void printsJsonResult() {
        int exitCode = run(Map.of(), "--file", SHOP, "--format", "json", "-s", "worker");

        assertEquals(0, exitCode, err::toString);
        String output = out.toString();
        assertTrue(output.contains("\"project\" : \"shop_app\""), output);
        assertTrue(output.contains("\"service\" : \"worker\""), output);
        assertFalse(output.contains("\"service\" : \"web\""), output);
    }

    @Test
    void acceptsCommaSeparatedServices() {
        int exitCode = run(Map.of(), "-f", SHOP, "-s", "web,worker", "--project-name", "renamed", "--format", "json");
        assertEquals(0, exitCode, err::toString);
        assertTrue(out.toString().contains("\"project\" : \"renamed\""), out::toString);
    }

    @Test
    void failedPlanExitsWithOne() {
        int exitCode = run(Map.of(), "-f", PROJECTS.resolve("broken").resolve("compose.yaml").toString());
        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error: service 'api': external secrets are not supported: vault_token"),
            err::toString);
    }

    @Test
    void missingProjectFileIsAUsageError() {
        int exitCode = run(Map.of(), "-f", tempDir.resolve("nope.yaml").toString());
        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("Project file not found"), err::toString);
    }

    @Test
    void readsDefaultsFromTomlNextToProject() throws IOException {
        Path compose = copyShop();
        Files.writeString(tempDir.resolve("meshdeploy.toml"), """
            [plan]
            project_name = "from-toml"
            format = "json"
            services = ["worker"]
            """);

        int exitCode = run(Map.of(), "-f", compose.toString());

        assertEquals(0, exitCode, err::toString);
        String output = out.toString();
        assertTrue(output.contains("\"project\" : \"from-toml\""), output);
        assertFalse(output.contains("\"service\" : \"web\""), output);
    }

    @Test
    void commandLineOverridesToml() throws IOException {
        Path compose = copyShop();
        Files.writeString(tempDir.resolve("meshdeploy.toml"), """
            [plan]
            format = "json"
            """);

        int exitCode = run(Map.of(), "-f", compose.toString(), "--format", "text");

        assertEquals(0, exitCode, err::toString);
        assertTrue(out.toString().startsWith("WARNING: "), out::toString);
    }

    @Test
    void brokenTomlIsAUsageError() throws IOException {
        Path compose = copyShop();
        Files.writeString(tempDir.resolve("meshdeploy.toml"), "[plan\nformat = ");

        int exitCode = run(Map.of(), "-f", compose.toString());

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("Invalid "), err::toString);
    }

    @Test
    void logLevelComesFromEnvironmentWhenNotGiven() {
        int exitCode = run(Map.of(PlanCommand.LOG_LEVEL_ENV, "loud"), "-f", SHOP);
        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("Unsupported log level: loud"), err::toString);

        out.getBuffer().setLength(0);
        err.getBuffer().setLength(0);
        assertEquals(0, run(Map.of(PlanCommand.LOG_LEVEL_ENV, "loud"), "-f", SHOP, "--log-level", "error"), err::toString);
    }

    @Test
    void rejectsUnknownFormat() {
        int exitCode = run(Map.of(), "-f", SHOP, "--format", "yaml");
        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("Unsupported output format: yaml"), err::toString);
    }

    @Test
    void printsVersion() {
        assertEquals(0, run(Map.of(), "--version"));
        assertTrue(out.toString().startsWith("mesh-plan 0.0.0-dev"), out::toString);
        assertTrue(out.toString().contains("JVM: "), out::toString);
    }

    @Test
    void describesMountsWithoutOptionalDetails() {
        assertEquals("api: secret token -> /run/secrets/token",
            PlanCommand.describeMount("api", Map.of("secret", "token", "path", "/run/secrets/token")));
    }

    private Path copyShop() throws IOException {
        Path compose = tempDir.resolve("compose.yaml");
        Files.copy(Path.of(SHOP), compose);
        Files.createDirectories(tempDir.resolve("secrets"));
        Files.copy(PROJECTS.resolve("shop").resolve("secrets").resolve("db_password.txt"),
            tempDir.resolve("secrets").resolve("db_password.txt"));
        return compose;
    }

    private int run(Map<String, String> environment, String... args) {
        Function<String, String> lookup = environment::get;
        var commandLine = new CommandLine(new PlanCommand(lookup))
            .setExecutionExceptionHandler(new ShortErrorHandler());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
