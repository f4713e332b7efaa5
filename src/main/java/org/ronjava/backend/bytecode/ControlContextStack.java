package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.Completion;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.REnvironment;

import java.util.ArrayList;
import java.util.List;

/**
 * The stack of open loop and call contexts of one interpreter.
 * <p>
 * A transfer is delivered by {@link #signal}: it searches from the innermost context
 * outward for one of the required kind whose environment is the environment the
 * transfer was raised in, and returns an exception aimed at it.
 */
public final class ControlContextStack {
    private final List<ControlContext> contexts = new ArrayList<>();

    public ControlContext pushLoop(int stackDepth, int headPc, int exitPc, REnvironment env) {
        ControlContext context = ControlContext.loop(stackDepth, headPc, exitPc, env);
        contexts.add(context);
        return context;
    }

    public ControlContext pushCall(int stackDepth, REnvironment env) {
        ControlContext context = ControlContext.call(stackDepth, env);
        contexts.add(context);
        return context;
    }

    public ControlContext pop() {
        if (contexts.isEmpty()) {
            throw new RError(ErrorKind.BOUNDS_VIOLATION, "context stack underflow");
        }
        return contexts.remove(contexts.size() - 1);
    }

    public ControlContext peek() {
        return contexts.isEmpty() ? null : contexts.get(contexts.size() - 1);
    }

    public int size() {
        return contexts.size();
    }

    /**
     * Position of the context counted from the bottom, or -1.
     */
    public int indexOf(ControlContext context) {
        for (int i = contexts.size() - 1; i >= 0; i--) {
            if (contexts.get(i) == context) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Discards every context above the given one, keeping it.
     */
    public void unwindTo(ControlContext context) {
        int i = indexOf(context);
        if (i >= 0) {
            truncate(i + 1);
        }
    }

    /**
     * Discards the given context and everything above it.
     */
    public void popThrough(ControlContext context) {
        int i = indexOf(context);
        if (i >= 0) {
            truncate(i);
        }
    }

    public void truncate(int newSize) {
        while (contexts.size() > newSize) {
            contexts.remove(contexts.size() - 1);
        }
    }

    /**
     * Innermost context able to receive the transfer raised in env, or null.
     */
    public ControlContext findTarget(Completion completion, REnvironment env) {
        ControlContext.Kind wanted = completion.targetsLoop() ? ControlContext.Kind.LOOP : ControlContext.Kind.CALL;
        for (int i = contexts.size() - 1; i >= 0; i--) {
            ControlContext context = contexts.get(i);
            if (context.kind == wanted && context.env == env) {
                return context;
            }
        }
        return null;
    }

    /**
     * Builds the exception that delivers the transfer. Callers throw the result.
     *
     * @throws RError of kind NO_ENCLOSING_CONTEXT when nothing can receive it
     */
    public ControlFlowException signal(Completion completion, REnvironment env, Node call) {
        ControlContext target = findTarget(completion, env);
        if (target == null) {
            String message = completion.targetsLoop()
                    ? "no loop for break/next, jumping to top level"
                    : "no function to return from, jumping to top level";
            throw new RError(ErrorKind.NO_ENCLOSING_CONTEXT, message, call);
        }
        return new ControlFlowException(completion, target);
    }
}
