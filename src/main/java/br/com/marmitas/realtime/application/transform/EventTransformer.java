package br.com.marmitas.realtime.application.transform;

import br.com.marmitas.realtime.application.port.output.RealtimeMetrics;
import br.com.marmitas.realtime.domain.change.ChangeRecord;
import br.com.marmitas.realtime.domain.change.TableMapping;
import br.com.marmitas.realtime.domain.change.TransformedEvent;
import br.com.marmitas.realtime.domain.subscription.EventKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Turns raw change-feed records into push envelopes.
 *
 * Resolution order, each step a rejection point (null result, WARN log):
 * 1. table must be mapped to an entity type
 * 2. operation tag must be INSERT, UPDATE or DELETE
 * 3. row image must carry a non-empty id at the mapping's id field
 * 4. a custom transformer registered for the entity type replaces the data;
 *    if it fails, the untransformed row is used
 *
 * Never throws.
 */
public final class EventTransformer {
    private static final Logger log = LoggerFactory.getLogger(EventTransformer.class);

    private final RealtimeMetrics metrics;

    // table -> mapping, insertion ordered
    private final Map<String, TableMapping> tableMappings = new LinkedHashMap<>();
    private final ReentrantReadWriteLock mappingLock = new ReentrantReadWriteLock();

    // entityType -> transformer
    private final ConcurrentMap<String, EntityTransformer> customTransformers = new ConcurrentHashMap<>();

    public EventTransformer(RealtimeMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Transformer preloaded with the storefront tables and the product price enrichment.
     */
    public static EventTransformer withDefaults(List<String> tables, RealtimeMetrics metrics) {
        EventTransformer transformer = new EventTransformer(metrics);
        for (String table : tables) {
            transformer.addTableMapping(table, table);
        }
        transformer.registerTransformer(ProductPriceTransformer.ENTITY_TYPE, new ProductPriceTransformer());
        log.info("Event transformer initialized with tables {}", tables);
        return transformer;
    }

    /**
     * @return the normalized event, or null if the record cannot be delivered
     */
    public TransformedEvent transform(ChangeRecord change) {
        try {
            if (change == null || change.table() == null || change.table().isBlank()) {
                log.warn("Invalid change record: {}", change);
                metrics.recordTransformRejected("INVALID_PAYLOAD");
                return null;
            }

            Optional<TableMapping> mapping = findTableMapping(change.table());
            if (mapping.isEmpty()) {
                log.warn("No entity mapping for table {}", change.table());
                metrics.recordTransformRejected("UNMAPPED_TABLE");
                return null;
            }

            Optional<EventKind> kind = EventKind.fromOperation(change.eventType());
            if (kind.isEmpty()) {
                log.warn("Unknown operation {} on table {}", change.eventType(), change.table());
                metrics.recordTransformRejected("UNKNOWN_OPERATION");
                return null;
            }

            TableMapping resolved = mapping.get();
            JsonNode row = change.rowImage();
            String entityId = extractId(row, resolved.idField());
            if (entityId == null) {
                log.warn("Missing entity id in change: table={}, idField={}", change.table(), resolved.idField());
                metrics.recordTransformRejected("MISSING_ID");
                return null;
            }

            JsonNode data = applyCustomTransformer(resolved.entityType(), change, row);

            log.debug("Transformed change: table={}, entityType={}, kind={}, id={}",
                change.table(), resolved.entityType(), kind.get(), entityId);

            return new TransformedEvent(resolved.entityType(), entityId, kind.get(), data, Instant.now(), change);

        } catch (Exception e) {
            log.error("Error transforming change record for table {}", change != null ? change.table() : null, e);
            metrics.recordTransformRejected("ERROR");
            return null;
        }
    }

    private JsonNode applyCustomTransformer(String entityType, ChangeRecord change, JsonNode row) {
        EntityTransformer custom = customTransformers.get(entityType);
        if (custom == null) {
            return row;
        }
        try {
            JsonNode transformed = custom.transform(change);
            if (transformed == null) {
                log.warn("Custom transformer for {} returned no data, using original row", entityType);
                return row;
            }
            return transformed;
        } catch (Exception e) {
            // Continue with the original row
            log.error("Error in custom transformer for {}", entityType, e);
            return row;
        }
    }

    private static String extractId(JsonNode row, String idField) {
        if (row == null || !row.isObject()) {
            return null;
        }
        JsonNode id = row.get(idField);
        if (id == null || id.isNull() || id.isContainerNode()) {
            return null;
        }
        String text = id.asText();
        return text.isEmpty() ? null : text;
    }

    // ========================================================================
    // MAPPING TABLE
    // ========================================================================

    public boolean addTableMapping(String table, String entityType) {
        return addTableMapping(table, entityType, TableMapping.DEFAULT_ID_FIELD);
    }

    /**
     * Map a table to an entity type; an existing mapping for the table is replaced in place.
     *
     * @return false, with nothing changed, when table or entity type is blank
     */
    public boolean addTableMapping(String table, String entityType, String idField) {
        if (isBlank(table) || isBlank(entityType)) {
            log.warn("Ignoring table mapping with missing table or entity type: table={}, entityType={}",
                table, entityType);
            return false;
        }
        TableMapping mapping = new TableMapping(table, entityType, idField);
        mappingLock.writeLock().lock();
        try {
            tableMappings.put(table, mapping);
        } finally {
            mappingLock.writeLock().unlock();
        }
        log.debug("Added table mapping {}", mapping);
        return true;
    }

    public boolean removeTableMapping(String table) {
        mappingLock.writeLock().lock();
        try {
            return tableMappings.remove(table) != null;
        } finally {
            mappingLock.writeLock().unlock();
        }
    }

    public Optional<TableMapping> findTableMapping(String table) {
        mappingLock.readLock().lock();
        try {
            return Optional.ofNullable(tableMappings.get(table));
        } finally {
            mappingLock.readLock().unlock();
        }
    }

    public List<TableMapping> getTableMappings() {
        mappingLock.readLock().lock();
        try {
            return new ArrayList<>(tableMappings.values());
        } finally {
            mappingLock.readLock().unlock();
        }
    }

    // ========================================================================
    // CUSTOM TRANSFORMERS
    // ========================================================================

    public boolean registerTransformer(String entityType, EntityTransformer transformer) {
        if (isBlank(entityType) || transformer == null) {
            log.warn("Ignoring transformer registration: entityType={}, transformer={}", entityType, transformer);
            return false;
        }
        customTransformers.put(entityType, transformer);
        log.debug("Registered custom transformer for {}", entityType);
        return true;
    }

    public boolean unregisterTransformer(String entityType) {
        return entityType != null && customTransformers.remove(entityType) != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
