package work.lcod.meshdeploy.cluster;

import java.util.List;
import java.util.Map;

/**
 * Image details as one machine (or the remote registry) reports them.
 */
public record ImageInspection(
    String id,
    List<String> repoTags,
    List<String> repoDigests,
    String created,
    String architecture,
    String os,
    long size,
    Map<String, String> labels
) {
    public ImageInspection {
        repoTags = repoTags == null ? List.of() : List.copyOf(repoTags);
        repoDigests = repoDigests == null ? List.of() : List.copyOf(repoDigests);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
