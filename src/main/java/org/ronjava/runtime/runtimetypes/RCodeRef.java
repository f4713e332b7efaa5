package org.ronjava.runtime.runtimetypes;

import org.ronjava.backend.bytecode.Code;
import org.ronjava.frontend.astnode.Node;

/**
 * A reference to a compiled code object, produced by quoting. It stands for the
 * unevaluated expression the code was compiled from.
 */
public final class RCodeRef extends RValue {
    public final Code code;

    public RCodeRef(Code code) {
        this.code = code;
    }

    public Node expression() {
        return code.source;
    }

    @Override
    public ValueType type() {
        return ValueType.CODE;
    }

    @Override
    public String deparse() {
        return "quote(" + code.source + ")";
    }
}
