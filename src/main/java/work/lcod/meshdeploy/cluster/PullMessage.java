package work.lcod.meshdeploy.cluster;

import java.util.Optional;
import java.util.Set;

/**
 * One progress message of an image pull. Layer messages carry an {@code id}; overall status lines do not.
 */
public record PullMessage(String id, String status, long current, long total, Optional<String> error) {
    private static final Set<String> DONE_STATUSES = Set.of(
        "Pull complete",
        "Already exists",
        "Download complete"
    );

    public PullMessage {
        error = error == null ? Optional.empty() : error.filter(message -> !message.isEmpty());
    }

    public static PullMessage status(String status) {
        return new PullMessage(null, status, 0, 0, Optional.empty());
    }

    public static PullMessage layer(String id, String status, long current, long total) {
        return new PullMessage(id, status, current, total, Optional.empty());
    }

    public static PullMessage failure(String error) {
        return new PullMessage(null, null, 0, 0, Optional.of(error));
    }

    public boolean isLayer() {
        return id != null && !id.isEmpty();
    }

    public boolean isDone() {
        return status != null && DONE_STATUSES.contains(status);
    }

    /** Download percentage of a layer, capped at 100. */
    public int percent() {
        if (isDone()) {
            return 100;
        }
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100, current * 100 / total);
    }
}
