package com.optics.osg.api;

/**
 * Single unchecked error type of the library.
 *
 * <p>
 * The {@link Kind} tells callers which layer refused the request: the graph
 * (bad port, cycle, duplicate connection), an analysis run (wrong light data,
 * impossible parameter), the property store (unknown key, wrong type,
 * read-only) or anything else.
 */
public class OpticException extends RuntimeException {

    /** Error taxonomy. */
    public enum Kind {
        GRAPH_STRUCTURE,
        ANALYSIS,
        PROPERTIES,
        OTHER
    }

    private final Kind kind;

    public OpticException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public OpticException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static OpticException graphStructure(String message) {
        return new OpticException(Kind.GRAPH_STRUCTURE, message);
    }

    public static OpticException analysis(String message) {
        return new OpticException(Kind.ANALYSIS, message);
    }

    public static OpticException analysis(String message, Throwable cause) {
        return new OpticException(Kind.ANALYSIS, message, cause);
    }

    public static OpticException properties(String message) {
        return new OpticException(Kind.PROPERTIES, message);
    }

    public static OpticException other(String message) {
        return new OpticException(Kind.OTHER, message);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
