package kvd;

import kvd.utils.Log;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Build metadata reported by the VERSION command. Name, version and description come
 * from {@code kvd-build.properties}, which Maven fills in at build time.
 */
public class BuildInfo {
    public static final String RESOURCE = "/kvd-build.properties";

    private final String name;
    private final String version;
    private final String description;

    public BuildInfo(String name, String version, String description) {
        this.name = name;
        this.version = version;
        this.description = description;
    }

    public static BuildInfo load() {
        Properties props = new Properties();
        try (InputStream in = BuildInfo.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                Log.warn("Build info resource " + RESOURCE + " not found");
            }
        } catch (IOException e) {
            Log.warn("Failed to read build info: " + e.getMessage());
        }
        return new BuildInfo(
                props.getProperty("name", "kvd"),
                props.getProperty("version", "unknown"),
                props.getProperty("description", ""));
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public String getJavaVersion() {
        return System.getProperty("java.version");
    }

    public String getOs() {
        return System.getProperty("os.name") + " " + System.getProperty("os.arch");
    }

    /** Multi-line summary, one {@code Key: value} pair per line. */
    public String describe() {
        return "Version: " + version + "\n"
                + "Name: " + name + "\n"
                + "Description: " + description + "\n"
                + "Java: " + getJavaVersion() + "\n"
                + "OS: " + getOs();
    }
}
