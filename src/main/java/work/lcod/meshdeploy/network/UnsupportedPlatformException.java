package work.lcod.meshdeploy.network;

public class UnsupportedPlatformException extends RuntimeException {
    private final String platform;

    public UnsupportedPlatformException(String platform) {
        super("not supported on " + platform);
        this.platform = platform;
    }

    public String platform() {
        return platform;
    }
}
