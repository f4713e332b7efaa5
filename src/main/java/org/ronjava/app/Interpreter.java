package org.ronjava.app;

import org.ronjava.backend.bytecode.BytecodeInterpreter;
import org.ronjava.backend.bytecode.CompiledFunction;
import org.ronjava.backend.bytecode.ControlFlowException;
import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.mro.MethodRegistry;
import org.ronjava.runtime.operators.BaseEnvironment;
import org.ronjava.runtime.runtimetypes.Completion;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RValue;

import java.io.PrintStream;

/**
 * One independent interpreter: a context, a base environment of primitives and a
 * global environment below it.
 * <p>
 * {@link #evaluate(Node)} is the top-level entry and reports every outcome as a
 * {@link Completion}. {@link #eval(Node, REnvironment)} throws instead.
 */
public class Interpreter {
    private final InterpreterContext context;
    private final REnvironment baseEnv;
    private final REnvironment globalEnv;

    public Interpreter() {
        this(InterpreterOptions.loadDefaults());
    }

    public Interpreter(InterpreterOptions options) {
        this.context = new InterpreterContext(options);
        this.baseEnv = BaseEnvironment.create();
        this.globalEnv = new REnvironment(baseEnv, "R_GlobalEnv");
    }

    /**
     * Evaluates a top-level expression in the global environment. Errors and
     * stray transfers come back as completions; the stacks are reset after them.
     */
    public Completion evaluate(Node expression) {
        int stackBase = context.stack.size();
        context.visible = true;
        try {
            return Completion.normal(BytecodeInterpreter.eval(expression, globalEnv, context));
        } catch (RError e) {
            context.reset(stackBase);
            return Completion.error(e);
        } catch (ControlFlowException e) {
            context.reset(stackBase);
            return e.completion();
        }
    }

    public RValue eval(Node expression) {
        return eval(expression, globalEnv);
    }

    public RValue eval(Node expression, REnvironment env) {
        return BytecodeInterpreter.eval(expression, env, context);
    }

    public CompiledFunction compile(Node expression) {
        return BytecodeInterpreter.compile(expression, context);
    }

    /**
     * Whether the last top-level result should be printed.
     */
    public boolean isVisible() {
        return context.visible;
    }

    /**
     * May be called from any thread; the running evaluation stops at its next
     * interrupt check.
     */
    public void requestInterrupt() {
        context.requestInterrupt();
    }

    public REnvironment globalEnv() {
        return globalEnv;
    }

    public REnvironment baseEnv() {
        return baseEnv;
    }

    public InterpreterContext context() {
        return context;
    }

    public MethodRegistry methodRegistry() {
        return context.methodRegistry();
    }

    public void setOutput(PrintStream out) {
        context.setOut(out);
    }
}
