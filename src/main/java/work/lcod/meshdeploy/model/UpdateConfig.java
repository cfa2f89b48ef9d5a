package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Rolling update (or rollback) policy of a deploy block. {@code parallelism} is {@code null} when unset.
 */
public record UpdateConfig(
    Integer parallelism,
    Duration delay,
    @JsonProperty("failure_action") String failureAction,
    Duration monitor,
    @JsonProperty("max_failure_ratio") double maxFailureRatio,
    String order
) {
    public boolean hasDelay() {
        return delay != null && delay.compareTo(Duration.ZERO) > 0;
    }

    public boolean hasMonitor() {
        return monitor != null && monitor.compareTo(Duration.ZERO) > 0;
    }
}
