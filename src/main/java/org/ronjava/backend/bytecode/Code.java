package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.Node;

import java.util.Arrays;

/**
 * An immutable compiled instruction stream: one function body or one lazily
 * passed argument.
 * <p>
 * {@code instructionPcs} and {@code sources} run in parallel, one entry per
 * instruction; a source entry is a constant pool index of the expression the
 * instruction was compiled from, or -1.
 */
public final class Code {
    public final int[] bytecode;
    public final int[] instructionPcs;
    public final int[] sources;
    public final int stackLength;
    public final Node source;
    public final ConstantPool pool;
    private CompiledFunction owner;

    public Code(int[] bytecode, int[] instructionPcs, int[] sources, int stackLength, Node source, ConstantPool pool) {
        this.bytecode = bytecode;
        this.instructionPcs = instructionPcs;
        this.sources = sources;
        this.stackLength = stackLength;
        this.source = source;
        this.pool = pool;
    }

    void setOwner(CompiledFunction owner) {
        if (this.owner != null && this.owner != owner) {
            throw new IllegalStateException("code object already belongs to a function");
        }
        this.owner = owner;
    }

    public CompiledFunction owner() {
        return owner;
    }

    public int instructionCount() {
        return instructionPcs.length;
    }

    /**
     * The source expression of the instruction starting at or containing pc, or null.
     */
    public Node sourceAt(int pc) {
        int i = Arrays.binarySearch(instructionPcs, pc);
        if (i < 0) {
            i = -i - 2;
        }
        if (i < 0 || sources[i] < 0) {
            return null;
        }
        return (Node) pool.get(sources[i]);
    }

    @Override
    public String toString() {
        return Disassembler.disassemble(this);
    }
}
