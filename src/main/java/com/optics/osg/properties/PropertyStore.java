package com.optics.osg.properties;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.optics.osg.api.OpticException;

/**
 * Named node parameters, iterated in key order. Every failure is an
 * {@link OpticException} of kind PROPERTIES.
 */
public final class PropertyStore {
    private final Map<String, Property> properties = new TreeMap<>();

    public void create(String name, String description, Object value) {
        create(name, description, value, false, List.of());
    }

    public void create(String name, String description, Object value, PropertyValidator... validators) {
        create(name, description, value, false, List.of(validators));
    }

    public void create(String name, String description, Object value, boolean readOnly,
            List<PropertyValidator> validators) {
        if (value == null)
            throw OpticException.properties("property '" + name + "' must not be null");
        create(name, description, value.getClass(), value, readOnly, validators);
    }

    /**
     * Creates a property declared with a supertype of its initial value, so that
     * other implementations of a model (coatings, index models, apertures) can
     * later replace it.
     */
    public <T> void create(String name, String description, Class<T> type, T value) {
        create(name, description, type, value, false, List.of());
    }

    private void create(String name, String description, Class<?> type, Object value, boolean readOnly,
            List<PropertyValidator> validators) {
        if (properties.containsKey(name))
            throw OpticException.properties("property '" + name + "' already exists");
        properties.put(name, new Property(description, type, value, readOnly, validators));
    }

    public void set(String name, Object value) {
        property(name).setValue(name, value);
    }

    public Object get(String name) {
        return property(name).value();
    }

    public <T> T get(String name, Class<T> type) {
        Object v = get(name);
        if (!type.isInstance(v))
            throw OpticException.properties("property '" + name + "' is not of type " + type.getSimpleName());
        return type.cast(v);
    }

    public double getDouble(String name) {
        return get(name, Number.class).doubleValue();
    }

    public int getInt(String name) {
        return get(name, Number.class).intValue();
    }

    public boolean getBool(String name) {
        return get(name, Boolean.class);
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public Property property(String name) {
        Property p = properties.get(name);
        if (p == null)
            throw OpticException.properties("property '" + name + "' does not exist");
        return p;
    }

    public boolean contains(String name) {
        return properties.containsKey(name);
    }

    public int size() {
        return properties.size();
    }

    public Map<String, Property> asMap() {
        return Collections.unmodifiableMap(properties);
    }
}
