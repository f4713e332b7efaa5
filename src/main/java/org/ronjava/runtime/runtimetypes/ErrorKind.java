package org.ronjava.runtime.runtimetypes;

/**
 * Every condition the core can raise.
 */
public enum ErrorKind {
    UNBOUND_VARIABLE("UnboundVariable"),
    MISSING_ARGUMENT("MissingArgument"),
    NOT_CALLABLE("NotCallable"),
    INVALID_ASSIGNMENT_TARGET("InvalidAssignmentTarget"),
    ARITY_MISMATCH("ArityMismatch"),
    /** Internal consistency fault; never recovered from. */
    BOUNDS_VIOLATION("BoundsViolation"),
    INTERRUPT_REQUESTED("InterruptRequested"),
    INVALID_ARGUMENT("InvalidArgument"),
    NO_ENCLOSING_CONTEXT("NoEnclosingContext");

    public final String label;

    ErrorKind(String label) {
        this.label = label;
    }
}
