package work.lcod.strata.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine;

/**
 * Reads the build version from {@code strata-version.properties}, written by Maven resource
 * filtering, and falls back to the jar manifest.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String VERSION_RESOURCE = "/strata-version.properties";
    private static final String UNKNOWN = "development";

    @Override
    public String[] getVersion() throws IOException {
        return new String[] {
            "strata (java) " + version(),
            "JVM: " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }

    static String version() throws IOException {
        try (InputStream in = VersionProvider.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                String version = properties.getProperty("version", "").trim();
                if (!version.isEmpty() && !version.startsWith("${")) {
                    return version;
                }
            }
        }
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : UNKNOWN;
    }
}
