package work.lcod.automation.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    static final String VERSION_RESOURCE = "/lcod-automation-version.properties";

    @Override
    public String[] getVersion() throws IOException {
        return new String[] {
            "lcod-automation " + version(),
            "JVM " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }

    /** Manifest version when packaged, otherwise the version stamped into the build resources. */
    static String version() throws IOException {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        if (implementationVersion != null) {
            return implementationVersion;
        }
        try (InputStream in = VersionProvider.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                return "development";
            }
            var properties = new Properties();
            properties.load(in);
            var stamped = properties.getProperty("version", "");
            return stamped.isBlank() || stamped.startsWith("${") ? "development" : stamped;
        }
    }
}
