package br.com.marmitas.realtime.domain.subscription;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kind of row change a subscriber can be interested in.
 */
public enum EventKind {
    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    /** Wire value that stands for every kind. */
    public static final String ANY = "any";

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Map a change-feed operation tag (INSERT/UPDATE/DELETE) to an event kind.
     */
    public static Optional<EventKind> fromOperation(String operation) {
        if (operation == null) {
            return Optional.empty();
        }
        return switch (operation.toUpperCase(Locale.ROOT)) {
            case "INSERT" -> Optional.of(CREATED);
            case "UPDATE" -> Optional.of(UPDATED);
            case "DELETE" -> Optional.of(DELETED);
            default -> Optional.empty();
        };
    }

    /**
     * Parse wire names; "any" expands to all kinds. Unknown names are skipped.
     */
    public static Set<EventKind> parseAll(Iterable<String> names) {
        Set<EventKind> kinds = EnumSet.noneOf(EventKind.class);
        if (names == null) {
            return kinds;
        }
        for (String name : names) {
            if (name == null) continue;
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            if (ANY.equals(normalized)) {
                return EnumSet.allOf(EventKind.class);
            }
            for (EventKind kind : values()) {
                if (kind.wireName.equals(normalized)) {
                    kinds.add(kind);
                }
            }
        }
        return kinds;
    }
}
