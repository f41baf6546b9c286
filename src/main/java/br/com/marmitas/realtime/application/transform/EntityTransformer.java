package br.com.marmitas.realtime.application.transform;

import br.com.marmitas.realtime.domain.change.ChangeRecord;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Per-entity-type enrichment of the data pushed to subscribers.
 *
 * Receives the raw change and returns the replacement payload. Implementations must
 * not mutate the record's row images. A thrown exception or a null result makes the
 * transformer fall back to the untransformed row.
 */
@FunctionalInterface
public interface EntityTransformer {

    JsonNode transform(ChangeRecord change);
}
