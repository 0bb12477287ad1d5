package io.gamevault.storage.sql;

import com.j256.ormlite.field.DataType;
import com.j256.ormlite.field.DatabaseField;
import com.j256.ormlite.table.DatabaseTable;

/** One row per game: the current document plus bookkeeping columns. */
@DatabaseTable(tableName = "games")
public class GameRow {

    @DatabaseField(id = true, columnName = "id", width = 255)
    private String id;

    // null for unversioned documents
    @DatabaseField(columnName = "state_id")
    private Long stateId;

    // bumped on every upsert; part of the document identity
    @DatabaseField(columnName = "revision", canBeNull = false)
    private long revision;

    @DatabaseField(columnName = "ctx", dataType = DataType.LONG_STRING, canBeNull = false)
    private String ctx;

    GameRow() {
        // ORMLite
    }

    GameRow(String id, Long stateId, long revision, String ctx) {
        this.id = id;
        this.stateId = stateId;
        this.revision = revision;
        this.ctx = ctx;
    }

    public String id() { return id; }

    public Long stateId() { return stateId; }

    public long revision() { return revision; }

    public String ctx() { return ctx; }
}
