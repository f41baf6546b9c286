package br.com.marmitas.realtime.domain.change;

import java.util.Objects;

/**
 * Maps a database table onto the entity type exposed to subscribers.
 */
public record TableMapping(String table, String entityType, String idField) {

    public static final String DEFAULT_ID_FIELD = "id";

    public TableMapping {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(entityType, "entityType");
        idField = idField == null || idField.isBlank() ? DEFAULT_ID_FIELD : idField;
    }

    public static TableMapping of(String table, String entityType) {
        return new TableMapping(table, entityType, DEFAULT_ID_FIELD);
    }
}
