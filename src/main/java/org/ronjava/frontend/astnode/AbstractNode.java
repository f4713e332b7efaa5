package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.PrintVisitor;

import java.util.HashMap;
import java.util.Map;

/**
 * Abstract base class for expression tree nodes. It keeps the source position
 * used for error messages, and a lazily created annotation map used by the
 * compiler and the engine to cache per-node information (for example the compiled
 * form of an expression that a lazy primitive evaluates repeatedly).
 * <p>
 * toString() deparses the node with PrintVisitor.
 */
public abstract class AbstractNode implements Node {
    public int tokenIndex = -1;

    // Lazy initialization - only created when first annotation is set
    public Map<String, Object> annotations;

    @Override
    public int getIndex() {
        return tokenIndex;
    }

    @Override
    public void setIndex(int tokenIndex) {
        this.tokenIndex = tokenIndex;
    }

    /**
     * Returns the surface syntax of this subtree.
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }

    public void setAnnotation(String key, Object value) {
        if (annotations == null) {
            annotations = new HashMap<>();
        }
        annotations.put(key, value);
    }

    public Object getAnnotation(String key) {
        return annotations == null ? null : annotations.get(key);
    }
}
