package com.optics.osg.properties;

import com.optics.osg.api.OpticException;

/**
 * Condition a property value must satisfy. Validators ignore values of types
 * they do not know about.
 */
@FunctionalInterface
public interface PropertyValidator {

    /** @throws OpticException of kind PROPERTIES if the value is rejected */
    void validate(Object value);

    static PropertyValidator positive() {
        return v -> {
            if (v instanceof Number n && !(n.doubleValue() > 0.0))
                throw OpticException.properties("Validation failed: value " + v + " must be positive.");
        };
    }

    static PropertyValidator finite() {
        return v -> {
            if (v instanceof Number n && !Double.isFinite(n.doubleValue()))
                throw OpticException.properties("Validation failed: value " + v + " must be finite.");
        };
    }

    static PropertyValidator inRange(double min, double max) {
        return v -> {
            if (v instanceof Number n && !(n.doubleValue() >= min && n.doubleValue() <= max))
                throw OpticException.properties(
                        "Validation failed: value " + v + " is outside the allowed range [" + min + ", " + max + "].");
        };
    }

    static PropertyValidator nonZero() {
        return v -> {
            if (v instanceof Number n && (n.doubleValue() == 0.0 || Double.isNaN(n.doubleValue())))
                throw OpticException.properties("Validation failed: value " + v + " must not be zero.");
        };
    }

    static PropertyValidator notEmpty() {
        return v -> {
            if (v instanceof String s && s.isEmpty())
                throw OpticException.properties("Validation failed: string must not be empty.");
        };
    }
}
