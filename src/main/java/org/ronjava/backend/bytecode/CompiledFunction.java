package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.Node;

import java.util.List;

/**
 * The unit the compiler produces: the code objects of one function body, its
 * promise codes and default-value codes, plus the formal parameter list.
 * Promise immediates index into {@link #codeAt(int)}. The body is the last code.
 */
public final class CompiledFunction {
    private final List<Code> codes;
    private final List<Formal> formals;
    private final Node source;

    public CompiledFunction(List<Code> codes, List<Formal> formals, Node source) {
        this.codes = List.copyOf(codes);
        this.formals = List.copyOf(formals);
        this.source = source;
        for (Code code : this.codes) {
            code.setOwner(this);
        }
    }

    public Code body() {
        return codes.get(codes.size() - 1);
    }

    public Code codeAt(int index) {
        return codes.get(index);
    }

    public int codeCount() {
        return codes.size();
    }

    public List<Code> codes() {
        return codes;
    }

    public List<Formal> formals() {
        return formals;
    }

    /**
     * The function literal this was compiled from, or the top-level expression.
     */
    public Node source() {
        return source;
    }

    /**
     * A formal parameter and its default-value code, null when it has no default.
     */
    public record Formal(String name, Code defaultCode) {

        public boolean isDots() {
            return "...".equals(name);
        }
    }
}
