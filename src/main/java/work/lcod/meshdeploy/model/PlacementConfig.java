package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Placement hints. {@code constraints} stays {@code null} when absent so an explicit empty list is still visible.
 */
public record PlacementConfig(
    List<String> constraints,
    List<Map<String, String>> preferences,
    @JsonProperty("max_replicas_per_node") Integer maxReplicasPerNode
) {
    public PlacementConfig {
        constraints = constraints == null ? null : Copies.list(constraints);
        preferences = Copies.list(preferences);
    }
}
