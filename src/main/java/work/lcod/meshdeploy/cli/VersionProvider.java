package work.lcod.meshdeploy.cli;

import picocli.CommandLine;

/**
 * Reports the jar's Implementation-Version, written by the jar plugin.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "0.0.0-dev";

    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "mesh-plan " + (version == null || version.isBlank() ? UNRELEASED : version),
            "JVM: " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
