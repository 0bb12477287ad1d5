package io.gamevault.server;

import io.gamevault.core.LruCache;
import io.gamevault.storage.DurableStore;
import io.gamevault.storage.document.DocumentStore;
import io.gamevault.storage.log.LogStructuredStore;
import io.gamevault.storage.memory.InMemoryStore;
import io.gamevault.storage.sql.JdbcStore;

import java.util.logging.Logger;

/**
 * Wires a {@link DurableStore} and the caching facade from a {@link StorageConfig}.
 * <p>
 * Neither method connects; callers decide when to call connect().
 */
public final class StoreFactory {
    private static final Logger log = Logger.getLogger(StoreFactory.class.getName());

    private StoreFactory() {
        // utility
    }

    public static DurableStore create(StorageConfig cfg) {
        DurableStore store = switch (cfg.backend()) {
            case MEMORY -> new InMemoryStore();
            case LOG -> new LogStructuredStore(cfg.dataDir().resolve("log"));
            case DOCUMENT -> new DocumentStore(cfg.dataDir().resolve("documents"));
            case SQL -> new JdbcStore(cfg.jdbcSettings());
        };
        log.fine(() -> "built " + cfg.backend() + " store from " + cfg);
        return store;
    }

    public static CachingGameStorage open(StorageConfig cfg) {
        return new CachingGameStorage(create(cfg), new LruCache<>(cfg.cacheSize()), cfg.connectPolicy());
    }
}
