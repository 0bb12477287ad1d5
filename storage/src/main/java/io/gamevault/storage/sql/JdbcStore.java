package io.gamevault.storage.sql;

import com.j256.ormlite.dao.Dao;
import com.j256.ormlite.dao.DaoManager;
import com.j256.ormlite.jdbc.JdbcPooledConnectionSource;
import com.j256.ormlite.misc.TransactionManager;
import com.j256.ormlite.table.TableUtils;
import io.gamevault.core.GameState;
import io.gamevault.storage.AbstractDurableStore;
import io.gamevault.storage.StoreConnectionException;
import io.gamevault.storage.StoreException;
import io.gamevault.storage.StoreKind;

import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relational store: one row per game in table {@code games}, accessed through
 * ORMLite over a pooled JDBC connection source.
 * <p>
 * connect():
 *  - opens the pool (max free connections / max connection age from {@link JdbcSettings}),
 *  - creates the table if it does not exist,
 *  - runs a trivial query so bad credentials fail here and not on first use.
 * <p>
 * upsert() reads the current row and writes the new one in one transaction.
 * A versioned write whose stateID is below the stored row's is dropped, so
 * racing upserts can never move a game's row backwards. Document identity is
 * {@code <gameId>@<revision>}.
 */
public final class JdbcStore extends AbstractDurableStore {
    private static final Logger log = Logger.getLogger(JdbcStore.class.getName());

    private final JdbcSettings settings;

    private JdbcPooledConnectionSource source;
    private Dao<GameRow, String> games;

    public JdbcStore(JdbcSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public synchronized void connect() {
        try {
            source = new JdbcPooledConnectionSource(settings.url(), settings.username(), settings.password());
            source.setMaxConnectionsFree(settings.maxConnectionsFree());
            source.setMaxConnectionAgeMillis(settings.maxConnectionAgeMillis());
            TableUtils.createTableIfNotExists(source, GameRow.class);
            games = DaoManager.createDao(source, GameRow.class);
            games.queryRawValue("SELECT COUNT(*) FROM games");
        } catch (SQLException | IllegalArgumentException e) {
            // IllegalArgumentException: ORMLite does not recognise the JDBC URL
            closeSource();
            throw new StoreConnectionException("cannot connect to " + settings.redactedUrl(), e);
        }
        markConnected();
        log.info(() -> "sql store connected to " + settings.redactedUrl());
    }

    @Override
    public GameState findOne(String gameId) {
        ensureConnected();
        try {
            GameRow row = games.queryForId(requireGameId(gameId));
            if (row == null) {
                return null;
            }
            return GameState.parse(row.ctx()).withStoreId(row.id() + "@" + row.revision());
        } catch (SQLException e) {
            throw new StoreException("select failed for game " + gameId, e);
        }
    }

    @Override
    public void upsert(String gameId, GameState state) {
        ensureConnected();
        requireGameId(gameId);
        Objects.requireNonNull(state, "state");
        String ctx = state.withoutStoreId().toJson();
        try {
            TransactionManager.callInTransaction(source, () -> {
                GameRow current = games.queryForId(gameId);
                if (current != null && isBehind(state, current)) {
                    log.fine(() -> "dropped out-of-order upsert for " + gameId + " (stateID "
                            + state.stateId() + " < " + current.stateId() + ")");
                    return null;
                }
                long revision = current == null ? 1L : current.revision() + 1;
                Long stateId = state.hasStateId() ? state.stateId() : null;
                games.createOrUpdate(new GameRow(gameId, stateId, revision, ctx));
                return null;
            });
        } catch (SQLException e) {
            throw new StoreException("upsert failed for game " + gameId, e);
        }
    }

    private static boolean isBehind(GameState incoming, GameRow stored) {
        return incoming.hasStateId() && stored.stateId() != null && incoming.stateId() < stored.stateId();
    }

    @Override
    public boolean exists(String gameId) {
        ensureConnected();
        try {
            return games.idExists(requireGameId(gameId));
        } catch (SQLException e) {
            throw new StoreException("exists check failed for game " + gameId, e);
        }
    }

    @Override
    public StoreKind kind() {
        return StoreKind.SQL;
    }

    @Override
    public synchronized void close() {
        markClosed();
        closeSource();
    }

    private void closeSource() {
        if (source == null) return;
        try {
            source.close();
        } catch (Exception e) {
            log.log(Level.WARNING, "failed to close connection pool for " + settings.redactedUrl(), e);
        }
        source = null;
        games = null;
    }
}
