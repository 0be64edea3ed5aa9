package com.optionsterminal.oms;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.List;

/**
 * Binds one strategy leg without letting a bad value fail the whole request body.
 *
 * <p>Each leg is read as a tree and converted on its own. A leg whose values cannot be
 * bound (an unknown action or right, a non-numeric quantity, a leg that is not an object)
 * comes back as an unreadable {@link OrderLeg} carrying the reason, and is rejected later
 * as that leg's own failure.
 */
public class LenientOrderLegDeserializer extends StdDeserializer<OrderLeg> {

    public LenientOrderLegDeserializer() {
        super(OrderLeg.class);
    }

    @Override
    public OrderLeg deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(parser);
        if (node == null || !node.isObject()) {
            return OrderLeg.unreadable("Order leg must be a JSON object");
        }
        try {
            return ctxt.readTreeAsValue(node, OrderLeg.class);
        } catch (JsonProcessingException e) {
            return OrderLeg.unreadable(describe(e));
        }
    }

    @Override
    public OrderLeg getNullValue(DeserializationContext ctxt) {
        return OrderLeg.unreadable("Order leg is null");
    }

    static String describe(JsonProcessingException e) {
        String reason = e.getCause() != null && e.getCause().getMessage() != null
                ? e.getCause().getMessage()
                : e.getOriginalMessage();
        if (e instanceof JsonMappingException mapping) {
            List<JsonMappingException.Reference> path = mapping.getPath();
            if (!path.isEmpty() && path.get(path.size() - 1).getFieldName() != null) {
                return "Invalid value for " + path.get(path.size() - 1).getFieldName() + ": " + reason;
            }
        }
        return "Unreadable order leg: " + reason;
    }
}
