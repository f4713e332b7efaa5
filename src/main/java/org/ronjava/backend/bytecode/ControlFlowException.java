package org.ronjava.backend.bytecode;

import org.ronjava.runtime.runtimetypes.Completion;

/**
 * Carries a break, next or return to the context it targets. No stack trace is
 * captured. Activations that do not own the target let it pass; their open
 * contexts are discarded on the way.
 */
public class ControlFlowException extends RuntimeException {
    private final Completion completion;
    private final ControlContext target;

    public ControlFlowException(Completion completion, ControlContext target) {
        super(null, null, false, false);
        this.completion = completion;
        this.target = target;
    }

    public Completion completion() {
        return completion;
    }

    public ControlContext target() {
        return target;
    }
}
