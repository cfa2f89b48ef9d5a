package work.lcod.meshdeploy.cluster;

import java.util.List;

public record PruneReport(List<ImageDeleteItem> imagesDeleted, long spaceReclaimed) {
    public PruneReport {
        imagesDeleted = imagesDeleted == null ? List.of() : List.copyOf(imagesDeleted);
    }
}
