package work.lcod.meshdeploy.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.meshdeploy.shared.HumanSize;

/**
 * Image commands run against every (or a filtered set of) cluster machines, reporting per machine.
 * A failure on one machine is printed and does not stop the others.
 */
public final class ImageOperations {
    private static final Logger log = LoggerFactory.getLogger(ImageOperations.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final ClusterClient client;
    private final PrintWriter out;

    public ImageOperations(ClusterClient client, PrintWriter out) {
        this.client = Objects.requireNonNull(client, "client");
        this.out = Objects.requireNonNull(out, "out");
    }

    public void inspect(List<String> images) {
        var machines = listMachines();
        for (String image : images) {
            List<MachineResponse<ImageInspection>> responses;
            try {
                responses = client.inspectImage(image);
            } catch (ClusterException ex) {
                log.debug("Image '{}' not inspectable on the cluster, trying its registry: {}", image, ex.getMessage());
                inspectRemote(image, machines);
                continue;
            }
            for (var response : responses) {
                out.println("Machine: " + machines.displayName(response.machine()));
                printInspection(response);
            }
        }
        out.flush();
    }

    private void inspectRemote(String image, Machines machines) {
        List<MachineResponse<ImageInspection>> responses;
        try {
            responses = client.inspectRemoteImage(image);
        } catch (ClusterException ex) {
            out.println("Error inspecting image '" + image + "': " + ex.getMessage());
            return;
        }
        for (var response : responses) {
            out.println("Machine (Remote Lookup): " + machines.displayName(response.machine()));
            printInspection(response);
        }
    }

    private void printInspection(MachineResponse<ImageInspection> response) {
        if (response.failed()) {
            out.println("Error: " + response.error().get());
            return;
        }
        try {
            out.println(JSON_WRITER.writeValueAsString(response.payload().orElse(null)));
        } catch (JsonProcessingException ex) {
            out.println("Error marshaling image info: " + ex.getOriginalMessage());
        }
    }

    public void pull(String image, boolean allTags, List<String> machineFilter) {
        var machines = MachineFilter.expand(machineFilter);
        Optional<String> failure = Optional.empty();
        boolean started = false;
        try (var messages = client.pullImage(image, allTags, machines)) {
            var iterator = messages.iterator();
            while (iterator.hasNext()) {
                var message = iterator.next();
                if (message.error().isPresent()) {
                    failure = message.error();
                    break;
                }
                if (!started) {
                    out.println("Pulling " + image + "...");
                    started = true;
                }
                if (message.isLayer()) {
                    if (message.total() > 0 || message.isDone()) {
                        out.println(message.id() + ": " + message.status() + " " + message.percent() + "%");
                    }
                } else if (message.status() != null && !message.status().isEmpty()) {
                    out.println(message.status());
                }
            }
        } catch (ClusterException ex) {
            throw new ClusterException("pull image: " + ex.getMessage(), ex);
        }
        out.flush();
        if (failure.isPresent()) {
            throw new ClusterException("pull image: " + failure.get());
        }
        out.println("Pulled " + image);
        out.flush();
    }

    public void remove(List<String> images, RemoveImageOptions options, List<String> machineFilter) {
        var machines = listMachines();
        var targets = MachineFilter.expand(machineFilter);
        for (String image : images) {
            List<MachineResponse<List<ImageDeleteItem>>> responses;
            try {
                responses = client.removeImage(image, options, targets);
            } catch (ClusterException ex) {
                out.println("Error removing image '" + image + "': " + ex.getMessage());
                continue;
            }
            for (var response : responses) {
                String machine = machines.displayName(response.machine());
                if (response.failed()) {
                    out.println("[" + machine + "] Error: " + response.error().get());
                    continue;
                }
                var items = response.payload().orElse(List.of());
                if (items.isEmpty()) {
                    out.println("[" + machine + "] Image '" + image + "' not found or not removed.");
                    continue;
                }
                for (var item : items) {
                    if (item.hasUntagged()) {
                        out.println("[" + machine + "] Untagged: " + item.untagged());
                    }
                    if (item.hasDeleted()) {
                        out.println("[" + machine + "] Deleted: " + item.deleted());
                    }
                }
            }
        }
        out.flush();
    }

    /**
     * @throws IllegalArgumentException when a filter is not {@code name=value}
     */
    public void prune(List<String> filters, boolean all, List<String> machineFilter) {
        var machines = listMachines();
        var targets = MachineFilter.expand(machineFilter);
        var pruneFilters = PruneFilters.parse(filters, all);

        List<MachineResponse<PruneReport>> responses;
        try {
            responses = client.pruneImages(pruneFilters, targets);
        } catch (ClusterException ex) {
            throw new ClusterException("prune images: " + ex.getMessage(), ex);
        }
        for (var response : responses) {
            String machine = machines.displayName(response.machine());
            if (response.failed()) {
                out.println("[" + machine + "] Error: " + response.error().get());
                continue;
            }
            var report = response.payload().orElse(new PruneReport(List.of(), 0));
            if (!report.imagesDeleted().isEmpty()) {
                out.println("[" + machine + "] Deleted Images:");
                for (var item : report.imagesDeleted()) {
                    if (item.hasUntagged()) {
                        out.println("untagged: " + item.untagged());
                    }
                    if (item.hasDeleted()) {
                        out.println("deleted: " + item.deleted());
                    }
                }
                out.println();
            }
            out.println("[" + machine + "] Total reclaimed space: " + HumanSize.format(report.spaceReclaimed()));
        }
        out.flush();
    }

    public void tag(String source, String target, List<String> machineFilter) {
        try {
            client.tagImage(source, target, MachineFilter.expand(machineFilter));
        } catch (ClusterException ex) {
            throw new ClusterException("tag image: " + ex.getMessage(), ex);
        }
        out.println("Tagged " + source + " as " + target);
        out.flush();
    }

    private Machines listMachines() {
        try {
            var machines = new Machines(client.listMachines());
            log.debug("Cluster has {} machine(s)", machines.members().size());
            return machines;
        } catch (ClusterException ex) {
            throw new ClusterException("list machines: " + ex.getMessage(), ex);
        }
    }
}
