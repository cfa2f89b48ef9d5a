package work.lcod.meshdeploy.cluster;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * In-memory cluster with canned responses; records the calls it receives.
 */
class FakeClusterClient implements ClusterClient {
    final List<MachineInfo> machines = new ArrayList<>();
    final Map<String, List<MachineResponse<ImageInspection>>> inspections = new LinkedHashMap<>();
    final Map<String, List<MachineResponse<ImageInspection>>> remoteInspections = new LinkedHashMap<>();
    final Map<String, List<MachineResponse<List<ImageDeleteItem>>>> removals = new LinkedHashMap<>();
    final List<PullMessage> pullMessages = new ArrayList<>();
    List<MachineResponse<PruneReport>> pruneResponses = List.of();
    RuntimeException failure;
    boolean closed;
    boolean pullStreamClosed;

    Map<String, List<String>> lastPruneFilters;
    List<String> lastMachines;
    RemoveImageOptions lastRemoveOptions;
    String lastTag;

    @Override
    public List<MachineInfo> listMachines() {
        return List.copyOf(machines);
    }

    @Override
    public List<MachineResponse<ImageInspection>> inspectImage(String image) {
        var responses = inspections.get(image);
        if (responses == null) {
            throw new ClusterException("no such image: " + image);
        }
        return responses;
    }

    @Override
    public List<MachineResponse<ImageInspection>> inspectRemoteImage(String image) {
        var responses = remoteInspections.get(image);
        if (responses == null) {
            throw new ClusterException("manifest unknown");
        }
        return responses;
    }

    @Override
    public Stream<PullMessage> pullImage(String image, boolean allTags, List<String> machines) {
        failIfRequested();
        lastMachines = machines;
        return pullMessages.stream().onClose(() -> pullStreamClosed = true);
    }

    @Override
    public List<MachineResponse<List<ImageDeleteItem>>> removeImage(
        String image,
        RemoveImageOptions options,
        List<String> machines
    ) {
        lastRemoveOptions = options;
        lastMachines = machines;
        var responses = removals.get(image);
        if (responses == null) {
            throw new ClusterException("connection refused");
        }
        return responses;
    }

    @Override
    public List<MachineResponse<PruneReport>> pruneImages(Map<String, List<String>> filters, List<String> machines) {
        failIfRequested();
        lastPruneFilters = filters;
        lastMachines = machines;
        return pruneResponses;
    }

    @Override
    public void tagImage(String source, String target, List<String> machines) {
        failIfRequested();
        lastTag = source + " -> " + target;
        lastMachines = machines;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void failIfRequested() {
        if (failure != null) {
            throw failure;
        }
    }
}
