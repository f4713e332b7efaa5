package org.ronjava.backend.bytecode;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.ronjava.frontend.analysis.PrintVisitor;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.ValueType;

import java.util.Arrays;

/**
 * Human-readable and JSON listings of code objects, for debugging the compiler.
 */
public final class Disassembler {

    private Disassembler() {
    }

    public static String disassemble(CompiledFunction function) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Function ").append(function.source() == null ? "<anonymous>"
                : abbreviate(PrintVisitor.deparse(function.source()))).append(" ===\n");
        for (int i = 0; i < function.codeCount(); i++) {
            sb.append(i == function.codeCount() - 1 ? "--- body" : "--- code " + i).append(" ---\n");
            sb.append(disassemble(function.codeAt(i)));
        }
        return sb.toString();
    }

    public static String disassemble(Code code) {
        StringBuilder sb = new StringBuilder();
        sb.append("Stack length: ").append(code.stackLength).append("\n");
        int[] bc = code.bytecode;
        int pc = 0;
        while (pc < bc.length) {
            int startPc = pc;
            int opcode = bc[pc++];
            sb.append(String.format("%4d: ", startPc));
            if (!Opcodes.isValid(opcode)) {
                sb.append(Opcodes.name(opcode)).append("\n");
                continue;
            }
            sb.append(disassembleInstruction(code, startPc));
            pc = startPc + Opcodes.length(opcode);
            Node source = code.sourceAt(startPc);
            if (source != null && startPc == sourceStart(code, startPc)) {
                sb.append("    # ").append(abbreviate(PrintVisitor.deparse(source)));
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    // the source is printed only on the instruction it is attached to
    private static int sourceStart(Code code, int pc) {
        int i = Arrays.binarySearch(code.instructionPcs, pc);
        return i >= 0 && code.sources[i] >= 0 ? pc : -1;
    }

    private static String formatImmediate(Code code, int kind, int imm, int pcAfter) {
        ConstantPool pool = code.pool;
        switch (kind) {
            case Opcodes.IMM_CONST:
                return "[" + imm + "] " + abbreviate(describe(pool.get(imm)));
            case Opcodes.IMM_SYMBOL:
                return "`" + pool.getSymbol(imm) + "`";
            case Opcodes.IMM_CODE:
                return "code#" + imm;
            case Opcodes.IMM_JUMP:
                return "-> " + (pcAfter + imm);
            case Opcodes.IMM_TYPE:
                return ValueType.fromOrdinal(imm).typeName;
            case Opcodes.IMM_ARGS:
                return argsToString((int[]) pool.get(imm));
            case Opcodes.IMM_NAMES:
                return imm == Opcodes.NO_NAMES ? "-" : namesToString((String[]) pool.get(imm));
            case Opcodes.IMM_FUNCTION:
                return "[" + imm + "] function";
            default:
                return Integer.toString(imm);
        }
    }

    private static String argsToString(int[] args) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (args[i] == Opcodes.MISSING_ARG_IDX) {
                sb.append("<missing>");
            } else if (args[i] == Opcodes.DOTS_ARG_IDX) {
                sb.append("...");
            } else {
                sb.append("code#").append(args[i]);
            }
        }
        return sb.append(")").toString();
    }

    private static String namesToString(String[] names) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < names.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(names[i] == null ? "" : names[i]);
        }
        return sb.append("]").toString();
    }

    private static String describe(Object constant) {
        if (constant instanceof RValue v) {
            return v.deparse();
        }
        if (constant instanceof Node n) {
            return PrintVisitor.deparse(n);
        }
        return String.valueOf(constant);
    }

    private static String abbreviate(String s) {
        s = s.replace('\n', ' ');
        return s.length() > 60 ? s.substring(0, 57) + "..." : s;
    }

    /**
     * JSON listing of a code object: one entry per instruction with its pc, mnemonic,
     * decoded immediates and attached source.
     */
    public static String toJson(Code code) {
        JSONObject root = new JSONObject();
        root.put("stackLength", code.stackLength);
        JSONArray instructions = new JSONArray();
        int[] bc = code.bytecode;
        int pc = 0;
        while (pc < bc.length) {
            int startPc = pc;
            int opcode = bc[pc++];
            JSONObject insn = new JSONObject();
            insn.put("pc", startPc);
            insn.put("op", Opcodes.name(opcode));
            if (Opcodes.isValid(opcode)) {
                JSONArray immediates = new JSONArray();
                for (int kind : Opcodes.immediates(opcode)) {
                    int imm = bc[pc++];
                    immediates.add(kind == Opcodes.IMM_JUMP ? pc + imm : imm);
                }
                if (!immediates.isEmpty()) {
                    insn.put("imm", immediates);
                }
                insn.put("text", disassembleInstruction(code, startPc));
            }
            Node source = code.sourceAt(startPc);
            if (source != null && sourceStart(code, startPc) == startPc) {
                insn.put("source", PrintVisitor.deparse(source));
            }
            instructions.add(insn);
        }
        root.put("instructions", instructions);
        return JSON.toJSONString(root, JSONWriter.Feature.PrettyFormat);
    }

    private static String disassembleInstruction(Code code, int pc) {
        int opcode = code.bytecode[pc];
        StringBuilder sb = new StringBuilder(Opcodes.name(opcode));
        int p = pc + 1;
        for (int kind : Opcodes.immediates(opcode)) {
            int imm = code.bytecode[p++];
            sb.append(' ').append(formatImmediate(code, kind, imm, p));
        }
        return sb.toString();
    }
}
