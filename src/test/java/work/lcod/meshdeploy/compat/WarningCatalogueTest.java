package work.lcod.meshdeploy.compat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashSet;
import org.junit.jupiter.api.Test;
import work.lcod.meshdeploy.loader.ProjectLoader;

class WarningCatalogueTest {
    @Test
    void standardCatalogueKeepsRegistrationOrder() {
        var catalogue = WarningCatalogue.standard();
        var keys = catalogue.keys();
        assertEquals(keys.size(), catalogue.size());
        assertEquals("build", keys.get(0));
        assertEquals("deploy.update_config.max_failure_ratio", keys.get(keys.size() - 1));
        assertEquals(keys.size(), new HashSet<>(keys).size());
    }

    @Test
    void standardCatalogueCoversServiceAndDeployKeys() {
        var catalogue = WarningCatalogue.standard();
        for (var key : new String[] {"depends_on", "networks", "secrets", "use_api_socket", "net", "deploy.placement"}) {
            assertTrue(catalogue.get(key).isPresent(), key);
        }
        assertFalse(catalogue.get("image").isPresent());
        assertFalse(catalogue.get("deploy.replicas").isPresent());
        assertFalse(catalogue.get("deploy.update_config.order").isPresent());
    }

    @Test
    void genericRulesUseTheStandardMessage() {
        var catalogue = WarningCatalogue.standard();
        assertEquals("'cpu_quota' is not supported.", catalogue.get("cpu_quota").orElseThrow().message());
        assertEquals("'deploy.update_config.monitor' is not supported.",
            catalogue.get("deploy.update_config.monitor").orElseThrow().message());
    }

    @Test
    void rejectsDuplicateKeys() {
        var catalogue = WarningCatalogue.standard();
        var error = assertThrows(IllegalArgumentException.class,
            () -> catalogue.register("restart", "again", (project, service) -> true));
        assertEquals("Duplicate warning key: restart", error.getMessage());
    }

    @Test
    void ruleEvaluatesAgainstService() {
        var project = ProjectLoader.loadFromContent("""
            services:
              web:
                image: nginx
                restart: always
              db:
                image: postgres
            """, Path.of("demo").toAbsolutePath());
        var rule = WarningCatalogue.standard().get("restart").orElseThrow();
        var warning = rule.evaluate(project, project.service("web").orElseThrow());
        assertTrue(warning.isPresent());
        assertEquals("web", warning.get().service());
        assertTrue(rule.evaluate(project, project.service("db").orElseThrow()).isEmpty());
    }

    @Test
    void rulesSnapshotIsUnmodifiable() {
        var rules = WarningCatalogue.standard().rules();
        assertThrows(UnsupportedOperationException.class, () -> rules.remove(0));
    }
}
