package work.lcod.meshdeploy.cluster;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Connection to a running cluster. Fan-out calls target the given machines (names or ids);
 * an empty machine list means every machine. Calls throw {@link ClusterException} when the
 * request as a whole fails; failures on individual machines come back inside the responses.
 */
public interface ClusterClient extends AutoCloseable {
    List<MachineInfo> listMachines();

    List<MachineResponse<ImageInspection>> inspectImage(String image);

    /** Looks the image up in its remote registry, through the cluster machines. */
    List<MachineResponse<ImageInspection>> inspectRemoteImage(String image);

    /**
     * Streams pull progress until every targeted machine has the image. Callers must close the stream.
     */
    Stream<PullMessage> pullImage(String image, boolean allTags, List<String> machines);

    List<MachineResponse<List<ImageDeleteItem>>> removeImage(String image, RemoveImageOptions options, List<String> machines);

    List<MachineResponse<PruneReport>> pruneImages(Map<String, List<String>> filters, List<String> machines);

    void tagImage(String source, String target, List<String> machines);

    @Override
    void close();
}
