package br.com.marmitas.realtime.domain.change;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw row-level change notification as emitted by the database change feed.
 *
 * {@code eventType} is the operation tag (INSERT/UPDATE/DELETE) exactly as received.
 * {@code newRow} is present for inserts and updates, {@code oldRow} for deletes.
 */
public record ChangeRecord(
    @JsonProperty("table") String table,
    @JsonProperty("schema") String schema,
    @JsonProperty("eventType") String eventType,
    @JsonProperty("new") JsonNode newRow,
    @JsonProperty("old") JsonNode oldRow
) {
    public static ChangeRecord insert(String table, JsonNode row) {
        return new ChangeRecord(table, "public", "INSERT", row, null);
    }

    public static ChangeRecord update(String table, JsonNode newRow, JsonNode oldRow) {
        return new ChangeRecord(table, "public", "UPDATE", newRow, oldRow);
    }

    public static ChangeRecord delete(String table, JsonNode oldRow) {
        return new ChangeRecord(table, "public", "DELETE", null, oldRow);
    }

    /**
     * The row image carrying the entity: new row if present and non-empty, else old row.
     */
    @JsonIgnore
    public JsonNode rowImage() {
        if (newRow != null && !newRow.isNull() && !newRow.isEmpty()) {
            return newRow;
        }
        return oldRow;
    }
}
