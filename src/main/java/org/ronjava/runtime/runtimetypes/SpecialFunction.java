package org.ronjava.runtime.runtimetypes;

import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.CallNode;

/**
 * Implementation of a lazy primitive. It receives the unevaluated call and the
 * calling environment and evaluates what it needs.
 */
@FunctionalInterface
public interface SpecialFunction {

    RValue apply(CallNode call, REnvironment env, InterpreterContext ctx);
}
