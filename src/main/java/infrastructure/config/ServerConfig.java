package infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Server settings. Resolution order, later wins:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code crud-service.properties} on the classpath</li>
 *   <li>JVM system properties with the same keys</li>
 *   <li>command line: {@code [port] [dataFile]}</li>
 * </ol>
 */
public final class ServerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerConfig.class);

    public static final String RESOURCE = "crud-service.properties";

    public static final String HOST = "server.host";
    public static final String PORT = "server.port";
    public static final String WORKERS = "server.workers";
    public static final String DATA_FILE = "storage.file";

    private final String host;
    private final int port;
    private final int workers;
    private final Path dataFile;

    public ServerConfig(String host, int port, int workers, Path dataFile) {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException(PORT + " out of range: " + port);
        if (workers < 1) throw new IllegalArgumentException(WORKERS + " must be at least 1: " + workers);
        this.host = host;
        this.port = port;
        this.workers = workers;
        this.dataFile = dataFile;
    }

    public static ServerConfig load(String[] args) {
        Properties props = defaults();
        try (InputStream in = ServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
        for (String key : new String[]{HOST, PORT, WORKERS, DATA_FILE}) {
            String v = System.getProperty(key);
            if (v != null && !v.isBlank()) props.setProperty(key, v.trim());
        }
        if (args != null && args.length > 0) props.setProperty(PORT, args[0]);
        if (args != null && args.length > 1) props.setProperty(DATA_FILE, args[1]);

        ServerConfig config = fromProperties(props);
        LOGGER.info("config host={} port={} workers={} dataFile={}",
                config.host, config.port, config.workers, config.dataFile);
        return config;
    }

    static ServerConfig fromProperties(Properties props) {
        return new ServerConfig(
                props.getProperty(HOST, "0.0.0.0").trim(),
                intValue(props, PORT),
                intValue(props, WORKERS),
                Paths.get(props.getProperty(DATA_FILE).trim())
        );
    }

    static Properties defaults() {
        Properties p = new Properties();
        p.setProperty(HOST, "0.0.0.0");
        p.setProperty(PORT, "8000");
        p.setProperty(WORKERS, "8");
        p.setProperty(DATA_FILE, "data.json");
        return p;
    }

    private static int intValue(Properties props, String key) {
        String v = props.getProperty(key);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }

    public String host() { return host; }
    public int port() { return port; }
    public int workers() { return workers; }
    public Path dataFile() { return dataFile; }
}
