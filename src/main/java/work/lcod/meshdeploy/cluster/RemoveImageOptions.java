package work.lcod.meshdeploy.cluster;

/**
 * @param force remove the image even when containers use it
 * @param pruneChildren also delete untagged parent images
 */
public record RemoveImageOptions(boolean force, boolean pruneChildren) {
    public static RemoveImageOptions defaults() {
        return new RemoveImageOptions(false, true);
    }
}
