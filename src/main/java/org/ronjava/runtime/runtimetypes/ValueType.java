package org.ronjava.runtime.runtimetypes;

/**
 * The closed set of runtime value tags. Type-test instructions carry the ordinal
 * of one of these constants as their immediate.
 */
public enum ValueType {
    NULL("NULL"),
    LOGICAL("logical"),
    INTEGER("integer"),
    REAL("double"),
    STRING("character"),
    PAIRLIST("pairlist"),
    LIST("list"),
    ENVIRONMENT("environment"),
    CLOSURE("closure"),
    PROMISE("promise"),
    BUILTIN("builtin"),
    SPECIAL("special"),
    CODE("language"),
    /** The empty-argument marker bound to formals that were not supplied. */
    MISSING("missing");

    private static final ValueType[] VALUES = values();

    public final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    public static ValueType fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    public boolean isAtomic() {
        return this == LOGICAL || this == INTEGER || this == REAL || this == STRING;
    }

    public boolean isFunction() {
        return this == CLOSURE || this == BUILTIN || this == SPECIAL;
    }
}
