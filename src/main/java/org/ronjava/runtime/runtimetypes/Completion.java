package org.ronjava.runtime.runtimetypes;

/**
 * The typed outcome of an evaluation: a value, a loop or call transfer, or an error.
 */
public final class Completion {
    private static final Completion BREAK = new Completion(ControlFlowType.BREAK, null, null);
    private static final Completion CONTINUE = new Completion(ControlFlowType.CONTINUE, null, null);

    private final ControlFlowType type;
    private final RValue value;
    private final RError error;

    private Completion(ControlFlowType type, RValue value, RError error) {
        this.type = type;
        this.value = value;
        this.error = error;
    }

    public static Completion normal(RValue value) {
        return new Completion(ControlFlowType.NORMAL, value, null);
    }

    public static Completion breakLoop() {
        return BREAK;
    }

    public static Completion continueLoop() {
        return CONTINUE;
    }

    public static Completion returnValue(RValue value) {
        return new Completion(ControlFlowType.RETURN, value, null);
    }

    public static Completion error(RError error) {
        return new Completion(ControlFlowType.ERROR, null, error);
    }

    public ControlFlowType type() {
        return type;
    }

    public boolean isNormal() {
        return type == ControlFlowType.NORMAL;
    }

    /**
     * The carried value for NORMAL and RETURN, otherwise null.
     */
    public RValue value() {
        return value;
    }

    public RError error() {
        return error;
    }

    /**
     * True when the transfer is resolved by a loop context.
     */
    public boolean targetsLoop() {
        return type == ControlFlowType.BREAK || type == ControlFlowType.CONTINUE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NORMAL -> "Normal(" + value + ")";
            case RETURN -> "Return(" + value + ")";
            case ERROR -> "Error(" + error.kind().label + ")";
            default -> type.name();
        };
    }
}
