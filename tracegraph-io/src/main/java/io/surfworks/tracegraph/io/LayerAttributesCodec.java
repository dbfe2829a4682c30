package io.surfworks.tracegraph.io;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.tracegraph.core.attributes.ConvolutionLayerAttributes;
import io.surfworks.tracegraph.core.attributes.GenericLayerAttributes;
import io.surfworks.tracegraph.core.attributes.LayerAttributes;
import io.surfworks.tracegraph.core.attributes.LinearLayerAttributes;

/**
 * JSON form of {@link LayerAttributes}, discriminated by a {@code type} field
 * ({@code conv}, {@code linear} or {@code generic}).
 *
 * <p>The {@code type} field is reserved: a generic value stored under that name is not written.
 */
final class LayerAttributesCodec {

    private static final Logger LOG = Logger.getLogger(LayerAttributesCodec.class.getName());

    static final String TYPE_CONV = "conv";
    static final String TYPE_LINEAR = "linear";
    static final String TYPE_GENERIC = "generic";

    private static final String TYPE_FIELD = "type";

    private LayerAttributesCodec() {} // Utility class

    // ==================== Reading ====================

    static LayerAttributes read(JsonNode node, String location, ObjectMapper json) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new TraceFormatException(location, "expected an object");
        }
        String type = JsonFields.requireText(node, TYPE_FIELD, location);
        try {
            return switch (type) {
                case TYPE_CONV -> new ConvolutionLayerAttributes(
                        JsonFields.optionalBoolean(node, "weightRequiresGrad", true, location),
                        JsonFields.requireInt(node, "inChannels", location),
                        JsonFields.requireInt(node, "outChannels", location),
                        JsonFields.optionalIntList(node, "kernelSize", location),
                        JsonFields.optionalIntList(node, "stride", location),
                        JsonFields.optionalInt(node, "groups", 1, location),
                        JsonFields.optionalBoolean(node, "transpose", false, location),
                        JsonFields.optionalIntList(node, "paddingValues", location));
                case TYPE_LINEAR -> new LinearLayerAttributes(
                        JsonFields.optionalBoolean(node, "weightRequiresGrad", true, location),
                        JsonFields.requireInt(node, "inFeatures", location),
                        JsonFields.requireInt(node, "outFeatures", location),
                        JsonFields.optionalBoolean(node, "withBias", true, location));
                case TYPE_GENERIC -> new GenericLayerAttributes(genericValues(node, json));
                default -> throw new TraceFormatException(location + ".type", "unknown layer attribute type '" + type + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new TraceFormatException(location, e.getMessage(), e);
        }
    }

    private static Map<String, Object> genericValues(JsonNode node, ObjectMapper json) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equals(TYPE_FIELD) || field.getValue().isNull()) {
                continue;
            }
            values.put(field.getKey(), json.convertValue(field.getValue(), Object.class));
        }
        return values;
    }

    // ==================== Writing ====================

    static void write(ObjectNode target, String field, LayerAttributes attributes, ObjectMapper json) {
        if (attributes == null) {
            target.putNull(field);
            return;
        }
        ObjectNode out = target.putObject(field);
        if (attributes instanceof ConvolutionLayerAttributes conv) {
            out.put(TYPE_FIELD, TYPE_CONV);
            out.put("weightRequiresGrad", conv.weightRequiresGrad());
            out.put("inChannels", conv.inChannels());
            out.put("outChannels", conv.outChannels());
            JsonFields.putInts(out.putArray("kernelSize"), conv.kernelSize());
            JsonFields.putInts(out.putArray("stride"), conv.stride());
            out.put("groups", conv.groups());
            out.put("transpose", conv.transpose());
            JsonFields.putInts(out.putArray("paddingValues"), conv.paddingValues());
        } else if (attributes instanceof LinearLayerAttributes linear) {
            out.put(TYPE_FIELD, TYPE_LINEAR);
            out.put("weightRequiresGrad", linear.weightRequiresGrad());
            out.put("inFeatures", linear.inFeatures());
            out.put("outFeatures", linear.outFeatures());
            out.put("withBias", linear.withBias());
        } else if (attributes instanceof GenericLayerAttributes generic) {
            out.put(TYPE_FIELD, TYPE_GENERIC);
            for (Map.Entry<String, Object> entry : generic.values().entrySet()) {
                if (entry.getKey().equals(TYPE_FIELD)) {
                    LOG.warning(() -> "Dropping generic layer attribute '" + TYPE_FIELD
                            + "', the name is reserved for the attribute kind");
                    continue;
                }
                out.set(entry.getKey(), json.valueToTree(entry.getValue()));
            }
        }
    }
}
