package work.lcod.meshdeploy.cluster;

/**
 * Cluster-wide failure of a call, as opposed to a per-machine error carried in a {@link MachineResponse}.
 */
public class ClusterException extends RuntimeException {
    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
