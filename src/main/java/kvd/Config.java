package kvd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import kvd.protocol.RespDecoder;
import kvd.utils.Log;

import java.io.File;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "kvd.yaml";

    public int port = 9090;

    // Per-request defaults for RequestContext; 0 disables the deadline
    public long requestTimeoutMillis = 5000;
    public int requestRetries = 3;

    // Wire limits
    public int maxNestingDepth = RespDecoder.DEFAULT_MAX_NESTING_DEPTH;
    public int maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    public int maxArrayLength = RespDecoder.DEFAULT_MAX_ARRAY_LENGTH;
    public int maxLineLength = RespDecoder.DEFAULT_MAX_LINE_LENGTH;

    // 0 lets Netty pick
    public int ioThreads = 0;
    public int commandThreads = 2 * Runtime.getRuntime().availableProcessors();

    public boolean fairStoreLock = false;
    public long expirySweepIntervalMillis = 100;
    public int expirySweepMaxKeys = 20;

    public boolean debug = false;

    public Config() {
        // Default constructor for Jackson
    }

    /** Request deadline as a duration, or null when deadlines are disabled. */
    public Duration requestTimeout() {
        return requestTimeoutMillis > 0 ? Duration.ofMillis(requestTimeoutMillis) : null;
    }

    public static Config load(String filename) {
        Config config = new Config();
        File f = new File(filename);

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                Config loaded = mapper.readValue(f, Config.class);
                if (loaded != null) {
                    config = loaded;
                }
            } catch (Exception e) {
                Log.warn("Failed to load config " + filename + " (" + e.getMessage() + "). Using defaults.");
            }
        }

        String envPort = System.getenv("KVD_PORT");
        if (envPort != null) {
            try {
                config.port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring invalid KVD_PORT: " + envPort);
            }
        }

        config.validate();
        return config;
    }

    public void validate() {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (requestTimeoutMillis < 0) throw new IllegalArgumentException("requestTimeoutMillis must be >= 0");
        if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        if (maxBulkLength < 0 || maxArrayLength < 0) throw new IllegalArgumentException("wire limits must be >= 0");
        if (maxBulkLength > RespDecoder.MAX_BULK_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxBulkLength must be <= " + RespDecoder.MAX_BULK_LENGTH_LIMIT);
        }
        if (maxLineLength < 16) throw new IllegalArgumentException("maxLineLength must be >= 16");
        if (commandThreads < 1) throw new IllegalArgumentException("commandThreads must be >= 1");
        if (expirySweepIntervalMillis <= 0) throw new IllegalArgumentException("expirySweepIntervalMillis must be > 0");
    }
}
