package com.optics.osg.properties;

import java.util.List;

import com.optics.osg.api.OpticException;

/** A named, described, validated value. */
public final class Property {
    private final String description;
    private final Class<?> type;
    private final boolean readOnly;
    private final List<PropertyValidator> validators;
    private Object value;

    Property(String description, Class<?> type, Object value, boolean readOnly, List<PropertyValidator> validators) {
        if (value == null || !type.isInstance(value))
            throw OpticException.properties("property value must be a non-null " + type.getSimpleName());
        this.description = description;
        this.type = type;
        this.readOnly = readOnly;
        this.validators = List.copyOf(validators);
        for (PropertyValidator v : this.validators)
            v.validate(value);
        this.value = value;
    }

    public String description() {
        return description;
    }

    public Class<?> type() {
        return type;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public Object value() {
        return value;
    }

    void setValue(String name, Object newValue) {
        if (readOnly)
            throw OpticException.properties("property '" + name + "' is read-only");
        if (!type.isInstance(newValue))
            throw OpticException.properties("property '" + name + "' expects a value of type "
                    + type.getSimpleName() + ", got "
                    + (newValue == null ? "null" : newValue.getClass().getSimpleName()));
        for (PropertyValidator v : validators)
            v.validate(newValue);
        this.value = newValue;
    }
}
