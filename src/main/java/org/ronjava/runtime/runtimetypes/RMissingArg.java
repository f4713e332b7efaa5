package org.ronjava.runtime.runtimetypes;

/**
 * Marker bound to a formal parameter that was not supplied and has no default,
 * and passed for empty arguments. Reading it through a variable load raises
 * {@link ErrorKind#MISSING_ARGUMENT}.
 */
public final class RMissingArg extends RValue {
    public static final RMissingArg MISSING = new RMissingArg();

    private RMissingArg() {
        markShared();
    }

    @Override
    public ValueType type() {
        return ValueType.MISSING;
    }

    @Override
    public String deparse() {
        return "";
    }
}
