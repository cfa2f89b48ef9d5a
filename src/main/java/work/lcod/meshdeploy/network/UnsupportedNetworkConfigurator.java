package work.lcod.meshdeploy.network;

import java.net.InetAddress;
import java.util.Objects;

/**
 * Stand-in for platforms without a firewall integration. Every operation fails.
 */
public final class UnsupportedNetworkConfigurator implements NetworkConfigurator {
    private final String platform;

    public UnsupportedNetworkConfigurator(String platform) {
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    @Override
    public void configure(InetAddress machineIp) {
        throw new UnsupportedPlatformException(platform);
    }

    @Override
    public void cleanup() {
        throw new UnsupportedPlatformException(platform);
    }
}
