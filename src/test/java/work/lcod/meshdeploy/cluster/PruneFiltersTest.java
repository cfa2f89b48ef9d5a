package work.lcod.meshdeploy.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PruneFiltersTest {
    @Test
    void groupsRepeatedNames() {
        var filters = PruneFilters.parse(List.of("label=a", "label=b", "until=10m"), false);
        assertEquals(Map.of("label", List.of("a", "b"), "until", List.of("10m")), filters);
    }

    @Test
    void allAddsDanglingFalse() {
        assertEquals(Map.of("dangling", List.of("false")), PruneFilters.parse(List.of(), true));
        assertTrue(PruneFilters.parse(null, false).isEmpty());
    }

    @Test
    void splitsOnFirstEquals() {
        assertEquals(Map.of("label", List.of("k=v")), PruneFilters.parse(List.of("label=k=v"), false));
    }

    @Test
    void rejectsEntriesWithoutEquals() {
        var error = assertThrows(IllegalArgumentException.class, () -> PruneFilters.parse(List.of("until"), false));
        assertEquals("invalid filter 'until'", error.getMessage());
    }

    @Test
    void resultIsUnmodifiable() {
        var filters = PruneFilters.parse(List.of("until=1h"), false);
        assertThrows(UnsupportedOperationException.class, () -> filters.put("x", List.of()));
        assertThrows(UnsupportedOperationException.class, () -> filters.get("until").add("2h"));
    }
}
