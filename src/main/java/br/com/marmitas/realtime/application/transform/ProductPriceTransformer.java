package br.com.marmitas.realtime.application.transform;

import br.com.marmitas.realtime.domain.change.ChangeRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Adds a display-ready {@code formattedPrice} ("$12.50") to product rows.
 */
public final class ProductPriceTransformer implements EntityTransformer {

    public static final String ENTITY_TYPE = "products";

    @Override
    public JsonNode transform(ChangeRecord change) {
        JsonNode row = change.rowImage();
        if (row == null || !row.isObject()) {
            return JsonNodeFactory.instance.objectNode();
        }

        ObjectNode data = ((ObjectNode) row).deepCopy();
        JsonNode price = data.get("price");
        if (price != null && !price.isNull()) {
            data.put("formattedPrice", "$" + format(price));
        }
        return data;
    }

    private static String format(JsonNode price) {
        BigDecimal value = price.isNumber() ? price.decimalValue() : new BigDecimal(price.asText().trim());
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
