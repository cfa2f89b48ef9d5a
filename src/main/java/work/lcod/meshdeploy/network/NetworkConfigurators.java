package work.lcod.meshdeploy.network;

import java.util.Locale;
import java.util.Objects;

public final class NetworkConfigurators {
    private NetworkConfigurators() {}

    /**
     * Picks {@code linux} on Linux hosts; every other platform gets a configurator that refuses to run.
     */
    public static NetworkConfigurator forOperatingSystem(String osName, NetworkConfigurator linux) {
        Objects.requireNonNull(linux, "linux");
        String normalized = osName == null ? "" : osName.trim();
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (lower.startsWith("linux")) {
            return linux;
        }
        if (lower.startsWith("windows")) {
            return new UnsupportedNetworkConfigurator("Windows");
        }
        if (lower.startsWith("mac") || lower.startsWith("darwin")) {
            return new UnsupportedNetworkConfigurator("macOS");
        }
        return new UnsupportedNetworkConfigurator(normalized.isEmpty() ? "unknown platform" : normalized);
    }
}
