package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * The {@code deploy} block of a service.
 */
public record DeployConfig(
    String mode,
    Integer replicas,
    Map<String, String> labels,
    @JsonProperty("update_config") UpdateConfig updateConfig,
    @JsonProperty("rollback_config") UpdateConfig rollbackConfig,
    @JsonProperty("restart_policy") RestartPolicy restartPolicy,
    @JsonProperty("endpoint_mode") String endpointMode,
    PlacementConfig placement
) {
    public DeployConfig {
        labels = Copies.map(labels);
        placement = placement == null ? new PlacementConfig(null, null, null) : placement;
    }

    public static DeployConfig replicas(int replicas) {
        return new DeployConfig(null, replicas, null, null, null, null, null, null);
    }
}
