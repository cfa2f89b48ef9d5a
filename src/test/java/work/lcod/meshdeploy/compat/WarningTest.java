package work.lcod.meshdeploy.compat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class WarningTest {
    @Test
    void rendersServicePrefix() {
        var warning = new Warning("web", "depends_on", "'depends_on' is not supported.");
        assertEquals("service 'web': 'depends_on' is not supported.", warning.toString());
        assertFalse(warning.isProjectLevel());
    }

    @Test
    void projectLevelWarningIsJustTheMessage() {
        var warning = new Warning(null, "build", "'build' is not supported.");
        assertEquals("", warning.service());
        assertTrue(warning.isProjectLevel());
        assertEquals("'build' is not supported.", warning.toString());
    }
}
