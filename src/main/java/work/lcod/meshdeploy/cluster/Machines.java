package work.lcod.meshdeploy.cluster;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the cluster membership used to turn machine ids into display names.
 */
public record Machines(List<MachineInfo> members) {
    public Machines {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public Optional<MachineInfo> findByNameOrId(String nameOrId) {
        if (nameOrId == null || nameOrId.isEmpty()) {
            return Optional.empty();
        }
        for (var machine : members) {
            if (machine.id().equals(nameOrId) || machine.name().equals(nameOrId)) {
                return Optional.of(machine);
            }
        }
        return Optional.empty();
    }

    /** Name of the machine, or the raw identifier when it is not a known member. */
    public String displayName(String nameOrId) {
        return findByNameOrId(nameOrId).map(MachineInfo::name).orElse(nameOrId);
    }
}
