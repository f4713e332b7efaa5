package org.ronjava.backend.bytecode;

import org.ronjava.app.InterpreterOptions;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.mro.DefaultMethodRegistry;
import org.ronjava.runtime.mro.FormalMethodTable;
import org.ronjava.runtime.mro.MethodRegistry;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RError;

import java.io.PrintStream;

/**
 * Everything one interpreter instance shares between the compiler, the engine and
 * the primitives. Nothing here is global; two contexts never interact.
 */
public final class InterpreterContext {
    public final ConstantPool pool = new ConstantPool();
    public final OperandStack stack = new OperandStack();
    public final ControlContextStack contexts = new ControlContextStack();
    public final InterpreterOptions options;

    /** Whether the last evaluated result should be printed by a REPL. */
    public boolean visible = true;

    // Set from other threads; read at evaluation steps
    private volatile boolean interruptPending;
    private long steps;
    private int evalDepth;

    private MethodRegistry methodRegistry = new DefaultMethodRegistry();
    private FormalMethodTable formalMethods;
    private PrintStream out = System.out;

    public InterpreterContext(InterpreterOptions options) {
        this.options = options;
    }

    public void requestInterrupt() {
        interruptPending = true;
    }

    /**
     * Counts one evaluation step and looks at the interrupt flag every
     * {@code interruptCheckInterval} steps.
     */
    public void countStep() {
        if (++steps % options.interruptCheckInterval == 0) {
            checkInterrupt();
        }
    }

    public void checkInterrupt() {
        if (interruptPending) {
            interruptPending = false;
            throw new RError(ErrorKind.INTERRUPT_REQUESTED, "evaluation interrupted");
        }
    }

    public long steps() {
        return steps;
    }

    void enterEvaluation(Node source) {
        if (evalDepth >= options.maxCallDepth) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "evaluation nested too deeply: infinite recursion?", source);
        }
        countStep();
        evalDepth++;
    }

    void exitEvaluation() {
        evalDepth--;
    }

    public int evalDepth() {
        return evalDepth;
    }

    /**
     * Drops all operand-stack values and contexts, after an evaluation was abandoned.
     */
    public void reset(int stackSize) {
        stack.truncate(stackSize);
        contexts.truncate(0);
    }

    public MethodRegistry methodRegistry() {
        return methodRegistry;
    }

    public void setMethodRegistry(MethodRegistry methodRegistry) {
        this.methodRegistry = methodRegistry;
    }

    public FormalMethodTable formalMethods() {
        return formalMethods;
    }

    public void setFormalMethods(FormalMethodTable formalMethods) {
        this.formalMethods = formalMethods;
    }

    public PrintStream out() {
        return out;
    }

    public void setOut(PrintStream out) {
        this.out = out;
    }
}
