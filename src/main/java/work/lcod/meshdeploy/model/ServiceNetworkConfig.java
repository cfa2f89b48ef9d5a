package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Per-service attachment settings for one network.
 */
public record ServiceNetworkConfig(
    List<String> aliases,
    @JsonProperty("ipv4_address") String ipv4Address,
    @JsonProperty("ipv6_address") String ipv6Address,
    Integer priority
) {
    public ServiceNetworkConfig {
        aliases = Copies.list(aliases);
    }
}
