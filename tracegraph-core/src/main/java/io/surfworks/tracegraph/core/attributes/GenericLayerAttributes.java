package io.surfworks.tracegraph.core.attributes;

import java.util.Map;

/**
 * Free-form attributes for operators without a dedicated attribute type.
 *
 * @param values attribute name to value
 */
public record GenericLayerAttributes(Map<String, Object> values) implements LayerAttributes {

    public GenericLayerAttributes {
        values = Map.copyOf(values);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        return (T) values.get(name);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String name, T defaultValue) {
        Object value = values.get(name);
        return value != null ? (T) value : defaultValue;
    }
}
