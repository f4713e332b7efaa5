package org.ronjava.runtime.runtimetypes;

/**
 * Discriminant of an evaluation outcome.
 */
public enum ControlFlowType {
    /** Evaluation produced a value */
    NORMAL,

    /** Exit the innermost matching loop */
    BREAK,

    /** Start the next iteration of the innermost matching loop */
    CONTINUE,

    /** Complete the innermost matching call with a value */
    RETURN,

    /** Evaluation failed */
    ERROR
}
