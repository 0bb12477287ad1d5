package io.gamevault.storage.sql;

import java.util.Objects;

/**
 * Connection parameters for {@link JdbcStore}.
 *
 * @param url                    JDBC URL, e.g. {@code jdbc:sqlite:/var/lib/games.db}
 * @param username               may be null
 * @param password               may be null
 * @param maxConnectionsFree     idle connections kept in the pool
 * @param maxConnectionAgeMillis connections older than this are closed on release
 */
public record JdbcSettings(
        String url,
        String username,
        String password,
        int maxConnectionsFree,
        long maxConnectionAgeMillis
) {
    public static final int DEFAULT_MAX_FREE = 5;
    public static final long DEFAULT_MAX_AGE_MILLIS = 10_000L;

    public JdbcSettings {
        Objects.requireNonNull(url, "url");
        if (!url.startsWith("jdbc:")) throw new IllegalArgumentException("url must be a JDBC URL: " + url);
        if (maxConnectionsFree <= 0) throw new IllegalArgumentException("maxConnectionsFree must be > 0");
        if (maxConnectionAgeMillis <= 0) throw new IllegalArgumentException("maxConnectionAgeMillis must be > 0");
    }

    public static JdbcSettings of(String url) {
        return new JdbcSettings(url, null, null, DEFAULT_MAX_FREE, DEFAULT_MAX_AGE_MILLIS);
    }

    /** URL without any user-info or query part, for logs. */
    public String redactedUrl() {
        return redact(url);
    }

    public static String redact(String url) {
        int q = url.indexOf('?');
        String base = q < 0 ? url : url.substring(0, q);
        int at = base.lastIndexOf('@');
        int scheme = base.indexOf("//");
        if (at > 0 && scheme > 0 && at > scheme) {
            return base.substring(0, scheme + 2) + "***" + base.substring(at);
        }
        return base;
    }

    @Override
    public String toString() {
        return "JdbcSettings[url=" + redactedUrl() + ", maxConnectionsFree=" + maxConnectionsFree
                + ", maxConnectionAgeMillis=" + maxConnectionAgeMillis + "]";
    }
}
