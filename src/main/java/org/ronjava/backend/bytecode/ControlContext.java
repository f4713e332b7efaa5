package org.ronjava.backend.bytecode;

import org.ronjava.runtime.runtimetypes.REnvironment;

/**
 * A loop or call boundary that control transfers can unwind to. Records the
 * operand-stack depth at creation and, for loops, where to resume.
 */
public final class ControlContext {

    public enum Kind {
        LOOP,
        CALL
    }

    public final Kind kind;
    public final int stackDepth;
    public final int headPc;
    public final int exitPc;
    public final REnvironment env;

    private ControlContext(Kind kind, int stackDepth, int headPc, int exitPc, REnvironment env) {
        this.kind = kind;
        this.stackDepth = stackDepth;
        this.headPc = headPc;
        this.exitPc = exitPc;
        this.env = env;
    }

    public static ControlContext loop(int stackDepth, int headPc, int exitPc, REnvironment env) {
        return new ControlContext(Kind.LOOP, stackDepth, headPc, exitPc, env);
    }

    public static ControlContext call(int stackDepth, REnvironment env) {
        return new ControlContext(Kind.CALL, stackDepth, -1, -1, env);
    }

    @Override
    public String toString() {
        return kind == Kind.LOOP
                ? "Loop(depth=" + stackDepth + ", head=" + headPc + ", exit=" + exitPc + ")"
                : "Call(depth=" + stackDepth + ")";
    }
}
