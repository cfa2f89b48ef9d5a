package work.lcod.meshdeploy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

public record RestartPolicy(
    String condition,
    Duration delay,
    @JsonProperty("max_attempts") Integer maxAttempts,
    Duration window
) {}
