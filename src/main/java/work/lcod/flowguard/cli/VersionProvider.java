package work.lcod.flowguard.cli;

import picocli.CommandLine;

/**
 * Version from the jar manifest, {@code development} when running from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        var version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "flowguard " + (version != null ? version : DEVELOPMENT),
            "JVM " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
