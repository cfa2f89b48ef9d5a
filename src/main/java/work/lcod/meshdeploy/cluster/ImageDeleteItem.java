package work.lcod.meshdeploy.cluster;

/**
 * One line of an image removal: a reference that was untagged or a layer id that was deleted.
 */
public record ImageDeleteItem(String untagged, String deleted) {
    public static ImageDeleteItem untagged(String reference) {
        return new ImageDeleteItem(reference, null);
    }

    public static ImageDeleteItem deleted(String id) {
        return new ImageDeleteItem(null, id);
    }

    public boolean hasUntagged() {
        return untagged != null && !untagged.isEmpty();
    }

    public boolean hasDeleted() {
        return deleted != null && !deleted.isEmpty();
    }
}
