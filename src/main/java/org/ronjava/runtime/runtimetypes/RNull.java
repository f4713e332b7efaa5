package org.ronjava.runtime.runtimetypes;

/**
 * The NULL value. A singleton that is never mutated.
 */
public final class RNull extends RValue {
    public static final RNull NULL = new RNull();

    private RNull() {
        markShared();
    }

    @Override
    public ValueType type() {
        return ValueType.NULL;
    }

    @Override
    public int length() {
        return 0;
    }

    @Override
    public void setAttribute(String name, RValue value) {
        throw new RError(ErrorKind.INVALID_ARGUMENT, "attempt to set an attribute on NULL");
    }

    @Override
    public String deparse() {
        return "NULL";
    }
}
