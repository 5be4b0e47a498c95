package com.optics.osg.io;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;

import com.optics.osg.properties.Property;
import com.optics.osg.properties.PropertyStore;

/**
 * What a node has to say after an analysis: its identity, its properties and
 * the data it recorded. Groups list their members as children.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NodeReport {
    private String name, type, id;
    private boolean inverted;
    private Map<String, Object> properties = new LinkedHashMap<>();
    private Map<String, Object> results = new LinkedHashMap<>();
    private List<NodeReport> children;

    public NodeReport(String name, String type, String id) {
        this.name = name;
        this.type = type;
        this.id = id;
    }

    /** Copies the property values, turning non-scalar values into text. */
    public NodeReport withProperties(PropertyStore store) {
        for (Map.Entry<String, Property> e : store.asMap().entrySet())
            properties.put(e.getKey(), jsonValue(e.getValue().value()));
        return this;
    }

    public NodeReport withResult(String key, Object value) {
        results.put(key, value);
        return this;
    }

    static Object jsonValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String)
            return value;
        if (value instanceof Enum<?> e)
            return e.name();
        return value.toString();
    }
}
