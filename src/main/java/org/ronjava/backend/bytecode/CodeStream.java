package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for one code object. Branches name labels; offsets are patched when the
 * stream is finished. The builder also keeps a running operand-stack depth to size
 * the stack reservation of the finished code. Each label remembers the depth of the
 * first branch to it, and code after an unconditional branch or RET is unreachable
 * until a label restores a known depth.
 */
public class CodeStream {
    private final List<Integer> bytecode = new ArrayList<>();
    private final List<Integer> instructionPcs = new ArrayList<>();
    private final List<Integer> sources = new ArrayList<>();
    private final List<Integer> labelPcs = new ArrayList<>();
    private final List<Integer> labelDepths = new ArrayList<>();
    // {offset slot pc, label}
    private final List<int[]> patchPoints = new ArrayList<>();
    private int depth;
    private int maxDepth;
    private boolean reachable = true;

    public int mkLabel() {
        labelPcs.add(-1);
        labelDepths.add(-1);
        return labelPcs.size() - 1;
    }

    /**
     * Binds the label to the position of the next emitted instruction.
     */
    public CodeStream bind(int label) {
        labelPcs.set(label, bytecode.size());
        int known = labelDepths.get(label);
        if (reachable) {
            labelDepths.set(label, depth);
        } else if (known >= 0) {
            depth = known;
            reachable = true;
        }
        return this;
    }

    /**
     * Operand-stack depth at the next emitted instruction, relative to the start of
     * the code object.
     */
    public int depth() {
        return depth;
    }

    public boolean isReachable() {
        return reachable;
    }

    public CodeStream emit(short opcode, int... immediates) {
        if (immediates.length != Opcodes.immediates(opcode).length) {
            throw new IllegalArgumentException(Opcodes.name(opcode) + " takes "
                    + Opcodes.immediates(opcode).length + " immediates, got " + immediates.length);
        }
        instructionPcs.add(bytecode.size());
        sources.add(-1);
        bytecode.add((int) opcode);
        for (int imm : immediates) {
            bytecode.add(imm);
        }
        adjustDepth(opcode, immediates);
        if (opcode == Opcodes.RET) {
            reachable = false;
        }
        return this;
    }

    /**
     * Emits a jump-carrying instruction whose offset is resolved from the label.
     */
    public CodeStream emitBranch(short opcode, int label) {
        if (!Opcodes.isJump(opcode)) {
            throw new IllegalArgumentException(Opcodes.name(opcode) + " is not a branch");
        }
        instructionPcs.add(bytecode.size());
        sources.add(-1);
        bytecode.add((int) opcode);
        patchPoints.add(new int[]{bytecode.size(), label});
        bytecode.add(0);
        adjustDepth(opcode, new int[]{0});
        if (reachable && labelDepths.get(label) < 0) {
            labelDepths.set(label, depth);
        }
        if (opcode == Opcodes.BR) {
            reachable = false;
        }
        return this;
    }

    /**
     * Attaches a source expression (as a pool index) to the last emitted instruction.
     */
    public CodeStream addSource(int poolIndex) {
        sources.set(sources.size() - 1, poolIndex);
        return this;
    }

    public int currentPc() {
        return bytecode.size();
    }

    private void adjustDepth(short opcode, int[] imm) {
        int pops;
        int pushes;
        switch (opcode) {
            case Opcodes.PUSH, Opcodes.LDVAR, Opcodes.STARTASSIGN, Opcodes.LDDDVAR, Opcodes.LDFUN, Opcodes.PROMISE,
                 Opcodes.PUSH_CODE, Opcodes.CLOSE, Opcodes.DUP -> {
                pops = 0;
                pushes = 1;
            }
            case Opcodes.DUP2 -> {
                pops = 0;
                pushes = 2;
            }
            case Opcodes.POP, Opcodes.STVAR, Opcodes.BRTRUE, Opcodes.BRFALSE, Opcodes.RET -> {
                pops = 1;
                pushes = 0;
            }
            case Opcodes.LGL_AND, Opcodes.LGL_OR, Opcodes.ADD, Opcodes.SUB, Opcodes.MUL, Opcodes.LT,
                 Opcodes.EXTRACT1, Opcodes.SUBSET1 -> {
                pops = 2;
                pushes = 1;
            }
            case Opcodes.TEST_BOUNDS -> {
                pops = 0;
                pushes = 1;
            }
            case Opcodes.CALL_STACK -> {
                pops = imm[0] + 1;
                pushes = 1;
            }
            case Opcodes.DISPATCH_STACK -> {
                pops = imm[0];
                pushes = 1;
            }
            default -> {
                pops = 0;
                pushes = 0;
            }
        }
        depth = Math.max(0, depth - pops) + pushes;
        maxDepth = Math.max(maxDepth, depth);
    }

    /**
     * Resolves labels and produces the immutable code object.
     */
    public Code finish(Node source, ConstantPool pool) {
        int[] code = new int[bytecode.size()];
        for (int i = 0; i < code.length; i++) {
            code[i] = bytecode.get(i);
        }
        for (int[] patch : patchPoints) {
            int target = labelPcs.get(patch[1]);
            if (target < 0) {
                throw new IllegalStateException("unbound label " + patch[1]);
            }
            code[patch[0]] = target - (patch[0] + 1);
        }
        int[] pcs = new int[instructionPcs.size()];
        int[] srcs = new int[sources.size()];
        for (int i = 0; i < pcs.length; i++) {
            pcs[i] = instructionPcs.get(i);
            srcs[i] = sources.get(i);
        }
        return new Code(code, pcs, srcs, maxDepth, source, pool);
    }
}
