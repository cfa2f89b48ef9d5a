package work.lcod.meshdeploy.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.SecretSource;
import work.lcod.meshdeploy.model.ServiceDependency;
import work.lcod.meshdeploy.model.ServiceSecretConfig;

class ProjectLoaderTest {
    private static final Path SHOP = Path.of("src", "test", "resources", "projects", "shop", "compose.yaml");
    private static final Path WORKING_DIR = Path.of("demo").toAbsolutePath();

    @Test
    void loadsProjectFile() {
        var project = ProjectLoader.loadFromFile(SHOP);
        assertEquals("shop_app", project.name());
        assertEquals(List.of("web", "worker"), project.serviceNames());
        assertEquals(SHOP.toAbsolutePath().getParent().normalize(), project.workingDirectory());

        var web = project.service("web").orElseThrow();
        assertEquals("nginx:1.27", web.image());
        assertEquals("always", web.restart());
        assertEquals(Map.of("worker", ServiceDependency.started()), web.dependsOn());
        assertEquals(List.of(
            ServiceSecretConfig.of("api_key"),
            new ServiceSecretConfig("db_password", "/etc/app/db_password", "1000", "1000", 0400)
        ), web.secrets());

        assertEquals(new SecretSource.Inline("s3cr3t".getBytes()), project.secrets().get("api_key").source());
        assertEquals(new SecretSource.FileBacked(Path.of("./secrets/db_password.txt")),
            project.secrets().get("db_password").source());
    }

    @Test
    void projectNameOverrideWins() {
        var project = ProjectLoader.loadFromFile(SHOP, LoadOptions.defaults().withProjectName("Other Name"));
        assertEquals("othername", project.name());
    }

    @Test
    void projectNameFallsBackToWorkingDirectory() {
        var project = ProjectLoader.loadFromContent("""
            services:
              web:
                image: nginx
            """, Path.of("/srv/My-Stack"));
        assertEquals("my-stack", project.name());
    }

    @Test
    void normalizesProjectNames() {
        assertEquals("my_app-2", ProjectLoader.normalizeProjectName("My App!_-2"));
        assertEquals("", ProjectLoader.normalizeProjectName("..."));
    }

    @Test
    void emptyNormalizedNameIsRejected() {
        var error = assertThrows(IllegalArgumentException.class, () -> ProjectLoader.loadFromContent("""
            name: "!!!"
            services: {}
            """, WORKING_DIR));
        assertTrue(error.getMessage().startsWith("Project name is empty"));
    }

    @Test
    void servicesWithoutNetworksJoinTheDefaultNetwork() {
        var project = load("""
            services:
              web:
                image: nginx
              host:
                image: nginx
                network_mode: host
            """);
        assertEquals(List.of(Project.DEFAULT_NETWORK), List.copyOf(project.service("web").orElseThrow().networks().keySet()));
        assertTrue(project.service("host").orElseThrow().networks().isEmpty());
    }

    @Test
    void linksImplyDependencies() {
        var web = load("""
            services:
              web:
                image: nginx
                links:
                  - db:database
                  - cache
              db:
                image: postgres
              cache:
                image: redis
            """).service("web").orElseThrow();
        assertEquals(List.of("db:database", "cache"), web.links());
        assertEquals(List.of("db", "cache"), List.copyOf(web.dependsOn().keySet()));
    }

    @Test
    void expandsShortSyntax() {
        var web = load("""
            services:
              web:
                build: ./web
                dns: 1.1.1.1
                extra_hosts:
                  somehost: 162.242.195.82
                labels:
                  - com.example.tier=frontend
                shm_size: 64m
                cpu_rt_period: 11000us
                stop_grace_period: 1m30s
                secrets:
                  - source: token
                    mode: 288
            """).service("web").orElseThrow();
        assertEquals("./web", web.buildConfig().get("context"));
        assertEquals(List.of("1.1.1.1"), web.dns());
        assertEquals(List.of("somehost:162.242.195.82"), web.extraHosts());
        assertEquals(Map.of("com.example.tier", "frontend"), web.labels());
        assertEquals(64L << 20, web.shmSize());
        assertEquals(11000L, web.cpuRtPeriod());
        assertEquals(Duration.ofSeconds(90), web.stopGracePeriod());
        assertEquals(0440, web.secrets().get(0).mode());
    }

    @Test
    void bindsDeployBlock() {
        var deploy = load("""
            services:
              web:
                image: nginx
                deploy:
                  replicas: 2
                  update_config:
                    delay: 10s
                    order: start-first
            """).service("web").orElseThrow().deploy();
        assertEquals(2, deploy.replicas());
        assertEquals(Duration.ofSeconds(10), deploy.updateConfig().delay());
        assertEquals("start-first", deploy.updateConfig().order());
        assertNull(deploy.updateConfig().parallelism());
        assertNull(deploy.placement().constraints());
    }

    @Test
    void fillsEnvironmentSecrets() {
        var yaml = """
            services:
              web:
                image: nginx
            secrets:
              token:
                environment: API_TOKEN
              remote:
                external:
                  name: prod_token
            """;
        var options = LoadOptions.defaults().withWorkingDirectory(WORKING_DIR).withEnvironment(Map.of("API_TOKEN", "abc"));
        var project = ProjectLoader.loadFromContent(yaml, options);
        assertEquals("abc", project.secrets().get("token").content());
        assertTrue(project.secrets().get("remote").external());
        assertFalse(project.secrets().get("token").external());

        var missing = assertThrows(IllegalArgumentException.class,
            () -> ProjectLoader.loadFromContent(yaml, options.withEnvironment(Map.of())));
        assertEquals("environment variable 'API_TOKEN' required by secret 'token' is not set", missing.getMessage());
    }

    @Test
    void rejectsMalformedContent() {
        var error = assertThrows(IllegalArgumentException.class, () -> load("services: [web, db]"));
        assertEquals("'services' must be a mapping", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> load("services:\n  web: [oops"));
        assertThrows(IllegalArgumentException.class, () -> load(""));
    }

    @Test
    void missingFileIsReported() {
        var missing = Path.of("src", "test", "resources", "projects", "nope.yaml");
        var error = assertThrows(IllegalStateException.class, () -> ProjectLoader.loadFromFile(missing));
        assertTrue(error.getMessage().startsWith("Failed to read project: "));
    }

    private static Project load(String yaml) {
        return ProjectLoader.loadFromContent(yaml, LoadOptions.defaults().withWorkingDirectory(WORKING_DIR));
    }
}
