package org.ronjava.frontend.analysis;

import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.FunctionNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.SymbolNode;

/**
 * Visitor over the expression tree.
 */
public interface Visitor {

    void visit(SymbolNode node);

    void visit(ConstantNode node);

    void visit(MissingArgNode node);

    void visit(CallNode node);

    void visit(FunctionNode node);
}
