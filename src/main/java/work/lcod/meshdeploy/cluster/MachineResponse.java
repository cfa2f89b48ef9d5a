package work.lcod.meshdeploy.cluster;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a fan-out call on one machine: either a payload or that machine's error.
 */
public record MachineResponse<T>(String machine, Optional<T> payload, Optional<String> error) {
    public MachineResponse {
        Objects.requireNonNull(machine, "machine");
        Objects.requireNonNull(payload, "payload");
        error = error.filter(message -> !message.isEmpty());
    }

    public static <T> MachineResponse<T> success(String machine, T payload) {
        return new MachineResponse<>(machine, Optional.ofNullable(payload), Optional.empty());
    }

    public static <T> MachineResponse<T> failure(String machine, String error) {
        return new MachineResponse<>(machine, Optional.empty(), Optional.of(error));
    }

    public boolean failed() {
        return error.isPresent();
    }
}
