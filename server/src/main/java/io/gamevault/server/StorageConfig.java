package io.gamevault.server;

import io.gamevault.storage.StoreKind;
import io.gamevault.storage.sql.JdbcSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Storage configuration, from CLI flags or from the environment.
 *
 * Fields:
 *  - backend:          which {@link StoreKind} to build
 *  - sqlUrl:           JDBC URL for the sql backend
 *  - sqlUser:          optional database user
 *  - sqlPassword:      optional database password
 *  - dataDir:          root directory for the log and document backends
 *  - cacheSize:        capacity of the LRU cache
 *  - poolMaxFree:      idle JDBC connections kept in the pool
 *  - lenientConnect:   keep going when connect() fails
 */
public record StorageConfig(
        StoreKind backend,
        String sqlUrl,
        String sqlUser,
        String sqlPassword,
        Path dataDir,
        int cacheSize,
        int poolMaxFree,
        boolean lenientConnect
) {
    public static final Path DEFAULT_DATA_DIR = Path.of("./data");

    public static final String ENV_BACKEND = "GAMEVAULT_BACKEND";
    public static final String ENV_SQL_URL = "GAMEVAULT_SQL_URL";
    public static final String ENV_SQL_USER = "GAMEVAULT_SQL_USER";
    public static final String ENV_SQL_PASSWORD = "GAMEVAULT_SQL_PASSWORD";
    public static final String ENV_DATA_DIR = "GAMEVAULT_DATA_DIR";
    public static final String ENV_CACHE_SIZE = "GAMEVAULT_CACHE_SIZE";
    public static final String ENV_POOL_MAX_FREE = "GAMEVAULT_POOL_MAX_FREE";
    public static final String ENV_LENIENT_CONNECT = "GAMEVAULT_LENIENT_CONNECT";

    public StorageConfig {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(dataDir, "dataDir");
        if (backend == StoreKind.SQL && (sqlUrl == null || sqlUrl.isBlank())) {
            throw new IllegalArgumentException("sql backend needs a JDBC url");
        }
        if (cacheSize <= 0) throw new IllegalArgumentException("cacheSize must be > 0, got: " + cacheSize);
        if (poolMaxFree <= 0) throw new IllegalArgumentException("poolMaxFree must be > 0, got: " + poolMaxFree);
    }

    /** In-memory backend with default sizes. */
    public static StorageConfig defaults() {
        return new StorageConfig(StoreKind.MEMORY, null, null, null, DEFAULT_DATA_DIR,
                CachingGameStorage.DEFAULT_CACHE_SIZE, JdbcSettings.DEFAULT_MAX_FREE, false);
    }

    public ConnectPolicy connectPolicy() {
        return lenientConnect ? ConnectPolicy.LENIENT : ConnectPolicy.STRICT;
    }

    public JdbcSettings jdbcSettings() {
        if (sqlUrl == null) {
            throw new IllegalStateException("no JDBC url configured");
        }
        return new JdbcSettings(sqlUrl, sqlUser, sqlPassword, poolMaxFree, JdbcSettings.DEFAULT_MAX_AGE_MILLIS);
    }

    /** Flags parsed from a command line, plus whatever non-flag words followed. */
    public record CommandLine(StorageConfig config, List<String> operands, boolean helpRequested) {
    }

    /**
     * Parse a command line. Flags may appear anywhere; everything else is
     * returned as operands in order.
     *
     * Supported flags:
     *   --backend,   -b  memory|log|document|sql
     *   --url,       -u  JDBC url (implies sql unless --backend is given)
     *   --user           database user
     *   --password       database password
     *   --data-dir,  -d  directory for file-backed stores
     *   --cache-size, -c entries kept in the cache
     *   --pool-max-free  idle JDBC connections kept
     *   --lenient-connect    do not fail when the store is unreachable
     *   --help,      -h
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad value
     */
    public static CommandLine parse(String[] args) {
        StorageConfig d = defaults();
        StoreKind backend = null;
        String url = null;
        String user = null;
        String password = null;
        Path dataDir = d.dataDir();
        int cacheSize = d.cacheSize();
        int poolMaxFree = d.poolMaxFree();
        boolean lenient = false;
        boolean help = false;
        List<String> operands = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> help = true;
                case "--backend", "-b" -> backend = parseBackend(valueOf(args, i++));
                case "--url", "-u" -> url = valueOf(args, i++);
                case "--user" -> user = valueOf(args, i++);
                case "--password" -> password = valueOf(args, i++);
                case "--data-dir", "-d" -> dataDir = Path.of(valueOf(args, i++));
                case "--cache-size", "-c" -> cacheSize = parseInt("cache-size", valueOf(args, i++));
                case "--pool-max-free" -> poolMaxFree = parseInt("pool-max-free", valueOf(args, i++));
                case "--lenient-connect" -> lenient = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    operands.add(arg);
                }
            }
        }
        if (backend == null) {
            backend = url != null ? StoreKind.SQL : StoreKind.MEMORY;
        }
        var cfg = new StorageConfig(backend, url, user, password, dataDir,
                cacheSize, poolMaxFree, lenient);
        return new CommandLine(cfg, List.copyOf(operands), help);
    }

    /** Parse flags only; operands are rejected. */
    public static StorageConfig fromArgs(String[] args) {
        CommandLine cl = parse(args);
        if (!cl.operands().isEmpty()) {
            throw new IllegalArgumentException("Unexpected argument: " + cl.operands().get(0));
        }
        return cl.config();
    }

    public static StorageConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build from environment variables. Without {@value #ENV_BACKEND}, a
     * present {@value #ENV_SQL_URL} selects the sql backend; otherwise memory.
     */
    public static StorageConfig fromEnv(Map<String, String> env) {
        StorageConfig d = defaults();
        String url = blankToNull(env.get(ENV_SQL_URL));
        String backendName = blankToNull(env.get(ENV_BACKEND));
        StoreKind backend = backendName != null
                ? parseBackend(backendName)
                : (url != null ? StoreKind.SQL : StoreKind.MEMORY);

        String dir = blankToNull(env.get(ENV_DATA_DIR));
        String cache = blankToNull(env.get(ENV_CACHE_SIZE));
        String pool = blankToNull(env.get(ENV_POOL_MAX_FREE));

        return new StorageConfig(
                backend,
                url,
                blankToNull(env.get(ENV_SQL_USER)),
                blankToNull(env.get(ENV_SQL_PASSWORD)),
                dir == null ? d.dataDir() : Path.of(dir),
                cache == null ? d.cacheSize() : parseInt(ENV_CACHE_SIZE, cache),
                pool == null ? d.poolMaxFree() : parseInt(ENV_POOL_MAX_FREE, pool),
                Boolean.parseBoolean(env.get(ENV_LENIENT_CONNECT))
        );
    }

    public static String usage() {
        return """
            Options:
              --backend,    -b   memory | log | document | sql (default: memory)
              --url,        -u   JDBC url for the sql backend
              --user             database user
              --password         database password
              --data-dir,   -d   directory for log/document stores (default: ./data)
              --cache-size, -c   cache capacity (default: 1000)
              --pool-max-free    idle JDBC connections kept (default: 5)
              --lenient-connect  log connection failures instead of failing
              --help,       -h   Show this help message
            """;
    }

    @Override
    public String toString() {
        return "StorageConfig[backend=" + backend
                + (sqlUrl == null ? "" : ", sql=" + JdbcSettings.redact(sqlUrl))
                + ", dataDir=" + dataDir
                + ", cacheSize=" + cacheSize
                + ", lenientConnect=" + lenientConnect + "]";
    }

    private static String valueOf(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static StoreKind parseBackend(String name) {
        try {
            return StoreKind.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backend: " + name, e);
        }
    }

    private static int parseInt(String what, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + raw, e);
        }
    }


    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
