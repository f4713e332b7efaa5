package org.ronjava.runtime.runtimetypes;

import org.ronjava.backend.bytecode.Code;
import org.ronjava.backend.bytecode.CompiledFunction;

import java.util.List;

/**
 * A compiled function paired with the environment it was created in.
 */
public final class RClosure extends RValue {
    public final CompiledFunction function;
    public final REnvironment env;

    public RClosure(CompiledFunction function, REnvironment env) {
        this.function = function;
        this.env = env;
    }

    public List<CompiledFunction.Formal> formals() {
        return function.formals();
    }

    public Code body() {
        return function.body();
    }

    @Override
    public ValueType type() {
        return ValueType.CLOSURE;
    }

    @Override
    public RValue duplicate() {
        RClosure copy = new RClosure(function, env);
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    public String deparse() {
        return function.source() == null ? "<closure>" : function.source().toString();
    }
}
