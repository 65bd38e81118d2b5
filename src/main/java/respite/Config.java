package respite;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import respite.utils.Log;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Immutable server settings. Built once at startup from defaults, an optional
 * YAML file and command-line flags (in increasing precedence).
 *
 * <p>{@code dir} and {@code dbfilename} are labels only; no file is read or
 * written through them.
 */
public final class Config {
    public static final String DEFAULT_FILE = "respite.yaml";
    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_BIND = "127.0.0.1";

    private final int port;
    private final String bind;
    private final String dir;
    private final String dbFileName;
    private final boolean replyErrors;
    private final boolean verbose;

    private Config(Builder b) {
        this.port = b.port;
        this.bind = b.bind;
        this.dir = b.dir;
        this.dbFileName = b.dbFileName;
        this.replyErrors = b.replyErrors;
        this.verbose = b.verbose;
    }

    public static Config defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getPort() {
        return port;
    }

    public String getBind() {
        return bind;
    }

    public String getDir() {
        return dir;
    }

    public String getDbFileName() {
        return dbFileName;
    }

    public boolean isReplyErrors() {
        return replyErrors;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Looks up a parameter for CONFIG GET. Returns {@code null} for unknown
     * names and for parameters that were never set.
     */
    public String get(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "dir":
                return dir;
            case "dbfilename":
                return dbFileName;
            default:
                return null;
        }
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.port = port;
        b.bind = bind;
        b.dir = dir;
        b.dbFileName = dbFileName;
        b.replyErrors = replyErrors;
        b.verbose = verbose;
        return b;
    }

    /**
     * Reads a YAML settings file on top of the defaults.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public static Builder load(File file) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            Builder b = mapper.readValue(file, Builder.class);
            return b != null ? b : new Builder();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config " + file.getPath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the startup configuration. {@code --config <file>} names a YAML
     * file that must exist; otherwise {@value #DEFAULT_FILE} in the working
     * directory is used when present. Flags override file values.
     */
    public static Config fromArgs(String[] args) {
        String configPath = null;
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals("--config")) {
                configPath = args[i + 1];
            }
        }

        Builder b;
        if (configPath != null) {
            File f = new File(configPath);
            if (!f.exists()) {
                throw new UncheckedIOException(new IOException("Config file not found: " + configPath));
            }
            b = load(f);
            Log.info("Loaded config from " + f.getPath());
        } else if (new File(DEFAULT_FILE).exists()) {
            b = load(new File(DEFAULT_FILE));
            Log.info("Loaded config from " + DEFAULT_FILE);
        } else {
            b = new Builder();
        }

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--reply-errors":
                    b.replyErrors = true;
                    continue;
                case "--verbose":
                    b.verbose = true;
                    continue;
                case "--dir":
                case "--dbfilename":
                case "--port":
                case "--bind":
                case "--config":
                    break;
                default:
                    Log.warn("Ignoring unknown argument: " + flag);
                    continue;
            }

            if (i + 1 >= args.length) {
                Log.warn("Ignoring " + flag + ": missing value");
                continue;
            }
            String value = args[++i];
            switch (flag) {
                case "--dir":
                    b.dir = value;
                    break;
                case "--dbfilename":
                    b.dbFileName = value;
                    break;
                case "--port":
                    b.port(parsePort(value));
                    break;
                case "--bind":
                    b.bind = value;
                    break;
                default:
                    // --config, already applied
                    break;
            }
        }
        return b.build();
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", bind=" + bind + ", dir=" + dir
                + ", dbfilename=" + dbFileName + ", replyErrors=" + replyErrors + ", verbose=" + verbose + "}";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        @JsonProperty("port")
        private int port = DEFAULT_PORT;
        @JsonProperty("bind")
        private String bind = DEFAULT_BIND;
        @JsonProperty("dir")
        private String dir;
        @JsonProperty("dbfilename")
        private String dbFileName;
        @JsonProperty("reply-errors")
        private boolean replyErrors;
        @JsonProperty("verbose")
        private boolean verbose;

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder bind(String bind) {
            this.bind = bind;
            return this;
        }

        public Builder dir(String dir) {
            this.dir = dir;
            return this;
        }

        public Builder dbFileName(String dbFileName) {
            this.dbFileName = dbFileName;
            return this;
        }

        public Builder replyErrors(boolean replyErrors) {
            this.replyErrors = replyErrors;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Config build() {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            return new Config(this);
        }
    }
}
