package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;

/**
 * The empty argument, as in {@code x[]} or {@code f(a, , b)}.
 */
public class MissingArgNode extends AbstractNode {

    public MissingArgNode() {
    }

    public MissingArgNode(int tokenIndex) {
        this.tokenIndex = tokenIndex;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
