package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;

/**
 * A symbol reference. Two spellings are reserved: {@code ...} names the variadic
 * argument binding, and {@code ..N} names its N-th element.
 */
public class SymbolNode extends AbstractNode {
    public static final String DOTS = "...";

    /**
     * The symbol name. Interned, so that constant pool entries for the same
     * name share one identity.
     */
    public final String name;

    public SymbolNode(String name) {
        this(name, -1);
    }

    public SymbolNode(String name, int tokenIndex) {
        this.name = name.intern();
        this.tokenIndex = tokenIndex;
    }

    public boolean isDots() {
        return DOTS.equals(name);
    }

    /**
     * Returns N for a {@code ..N} symbol, or 0 when this is an ordinary symbol.
     */
    public int dotDotIndex() {
        if (name.length() < 3 || !name.startsWith("..")) {
            return 0;
        }
        for (int i = 2; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return 0;
            }
        }
        return Integer.parseInt(name.substring(2));
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
