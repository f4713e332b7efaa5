package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;

import java.util.List;

/**
 * A function literal: formal parameters with optional default expressions, and a body.
 */
public class FunctionNode extends AbstractNode {
    public final List<Formal> formals;
    public final Node body;

    public FunctionNode(List<Formal> formals, Node body) {
        this(formals, body, -1);
    }

    public FunctionNode(List<Formal> formals, Node body, int tokenIndex) {
        this.formals = List.copyOf(formals);
        this.body = body;
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * A formal parameter. {@code defaultValue} is null when the formal has no default.
     */
    public static final class Formal {
        public final String name;
        public final Node defaultValue;

        public Formal(String name, Node defaultValue) {
            this.name = name.intern();
            this.defaultValue = defaultValue;
        }

        public Formal(String name) {
            this(name, null);
        }
    }
}
