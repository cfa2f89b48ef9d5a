package work.lcod.meshdeploy.cluster;

import java.util.Objects;

/**
 * A cluster member as reported by {@link ClusterClient#listMachines()}.
 */
public record MachineInfo(String id, String name, String address) {
    public MachineInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
