package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;

/**
 * The Node interface represents a node in the expression tree handed to the compiler.
 * Nodes are produced by an external parser (or built directly by tools and tests)
 * and are never mutated by the compiler, except for cached annotations.
 */
public interface Node {

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    /**
     * Returns the source position this node was parsed from, or -1 when unknown.
     */
    int getIndex();

    void setIndex(int tokenIndex);
}
