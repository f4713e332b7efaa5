package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;
import org.ronjava.runtime.runtimetypes.RValue;

/**
 * A self-evaluating literal. The compiler places the value in the constant pool;
 * lazy primitives evaluating a ConstantNode get the value back unchanged.
 */
public class ConstantNode extends AbstractNode {
    public final RValue value;

    public ConstantNode(RValue value) {
        this(value, -1);
    }

    public ConstantNode(RValue value, int tokenIndex) {
        this.value = value;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
