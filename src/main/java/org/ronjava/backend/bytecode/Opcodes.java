package org.ronjava.backend.bytecode;

/**
 * Bytecode opcodes for the stack interpreter.
 * <p>
 * An instruction is one opcode slot followed by a fixed number of int immediates.
 * Immediates are constant pool indices, code indices within the owning compiled
 * function, small counts, type tags, or jump offsets. Jump offsets are relative to
 * the pc just after the offset slot.
 * <p>
 * Stack effects are written as {@code before -> after}, top of stack on the right.
 */
public class Opcodes {

    // Immediate kinds, used by the disassembler
    public static final int IMM_CONST = 1;
    public static final int IMM_SYMBOL = 2;
    public static final int IMM_CODE = 3;
    public static final int IMM_JUMP = 4;
    public static final int IMM_INT = 5;
    public static final int IMM_TYPE = 6;
    public static final int IMM_ARGS = 7;
    public static final int IMM_NAMES = 8;
    public static final int IMM_FUNCTION = 9;

    /** Argument index standing for an empty argument. */
    public static final int MISSING_ARG_IDX = -1;
    /** Argument index standing for the spliced variadic binding. */
    public static final int DOTS_ARG_IDX = -2;
    /** Names immediate of a call without argument names. */
    public static final int NO_NAMES = -1;

    // =================================================================
    // STACK MANIPULATION
    // =================================================================

    /** PUSH c: -> pool[c]. Sets the visible flag. */
    public static final short PUSH = 1;

    /** POP: v -> */
    public static final short POP = 2;

    /** DUP: v -> v v */
    public static final short DUP = 3;

    /** DUP2: a b -> a b a b */
    public static final short DUP2 = 4;

    /** SWAP: a b -> b a */
    public static final short SWAP = 5;

    /** PICK n: moves the value at depth n to the top. PICK 1 is SWAP. */
    public static final short PICK = 6;

    /** PUT n: moves the top value down to depth n. */
    public static final short PUT = 7;

    // =================================================================
    // VARIABLES
    // =================================================================

    /** LDVAR s: -> value of s. Forces promises; missing and unbound are errors. */
    public static final short LDVAR = 10;

    /** LDDDVAR s: -> N-th element of the variadic binding, for s = ..N */
    public static final short LDDDVAR = 11;

    /** LDFUN s: -> the nearest binding of s that is a function. */
    public static final short LDFUN = 12;

    /** STVAR s: v -> (binds s to v in the current environment) */
    public static final short STVAR = 13;

    /** IS t: v -> logical, TRUE when v has type tag t. */
    public static final short IS = 14;

    /** ISFUN: f -> f, failing with NotCallable unless f is a function. */
    public static final short ISFUN = 15;

    /**
     * STARTASSIGN s: -> value of s, as the target of a replacement assignment. A value
     * bound in an enclosing environment is marked shared, so the UNIQ that follows
     * copies it instead of updating the outer binding.
     */
    public static final short STARTASSIGN = 16;

    // =================================================================
    // PROMISES AND CODE
    // =================================================================

    /** PROMISE i: -> promise of code i in the current environment. */
    public static final short PROMISE = 20;

    /** PUSH_CODE i: -> reference to code i (the value of a quoted expression). */
    public static final short PUSH_CODE = 21;

    /** FORCE: p -> value of p */
    public static final short FORCE = 22;

    /** CLOSE f: -> closure of compiled function pool[f] over the current environment. */
    public static final short CLOSE = 23;

    // =================================================================
    // CONTROL FLOW
    // =================================================================

    /** BR o: unconditional branch. */
    public static final short BR = 30;

    /** BRTRUE o: v -> , branches when v is the logical TRUE. */
    public static final short BRTRUE = 31;

    /** BRFALSE o: v -> , branches when v is the logical FALSE. */
    public static final short BRFALSE = 32;

    /** BROBJ o: v -> v, branches when v carries a class attribute. */
    public static final short BROBJ = 33;

    /** BRNOTNUM o: a b -> a b, branches unless both are attribute-free numeric scalars. */
    public static final short BRNOTNUM = 34;

    /** BEGINLOOP o: pushes a loop context; the loop head is the next instruction, the exit is o. */
    public static final short BEGINLOOP = 35;

    /** ENDCONTEXT: restores the operand stack depth of the innermost context and pops it. */
    public static final short ENDCONTEXT = 36;

    /** RET: v -> , returns v from the current code object. */
    public static final short RET = 37;

    // =================================================================
    // CALLS
    // =================================================================

    /** CALL a n: f -> result. a: pool int[] of promise code indices, n: pool String[] of names. */
    public static final short CALL = 40;

    /** CALL_STACK k n: f v1..vk -> result */
    public static final short CALL_STACK = 41;

    /** DISPATCH a n s: receiver -> result, selector pool[s]. */
    public static final short DISPATCH = 42;

    /** DISPATCH_STACK k n s: v1..vk -> result, v1 is the receiver. */
    public static final short DISPATCH_STACK = 43;

    // =================================================================
    // LOGICAL
    // =================================================================

    /** ASBOOL: v -> TRUE|FALSE, failing on NA and on length zero. */
    public static final short ASBOOL = 50;

    /** ASLOGICAL: v -> TRUE|FALSE|NA */
    public static final short ASLOGICAL = 51;

    /** LGL_AND: a b -> a && b (three-valued) */
    public static final short LGL_AND = 52;

    /** LGL_OR: a b -> a || b (three-valued) */
    public static final short LGL_OR = 53;

    // =================================================================
    // SCALAR FAST PATH
    // Operands must be attribute-free numeric scalars (guarded by BRNOTNUM).
    // =================================================================

    public static final short ADD = 60;
    public static final short SUB = 61;
    public static final short MUL = 62;
    public static final short LT = 63;

    /** INC: n -> n + 1, in place after unsharing. */
    public static final short INC = 64;

    // =================================================================
    // INDEXING FAST PATH
    // =================================================================

    /** EXTRACT1: x i -> x[[i]] */
    public static final short EXTRACT1 = 70;

    /** SUBSET1: x i -> x[i] */
    public static final short SUBSET1 = 71;

    /** TEST_BOUNDS: seq i -> seq i (i <= length(seq)) */
    public static final short TEST_BOUNDS = 72;

    // =================================================================
    // SHARING AND VISIBILITY
    // =================================================================

    /** UNIQ: v -> v', duplicated when v is shared. */
    public static final short UNIQ = 80;

    public static final short INVISIBLE = 81;
    public static final short VISIBLE = 82;

    private static final int MAX_OPCODE = 96;
    private static final String[] NAMES = new String[MAX_OPCODE];
    private static final int[][] IMMEDIATES = new int[MAX_OPCODE][];

    static {
        def(PUSH, "push", IMM_CONST);
        def(POP, "pop");
        def(DUP, "dup");
        def(DUP2, "dup2");
        def(SWAP, "swap");
        def(PICK, "pick", IMM_INT);
        def(PUT, "put", IMM_INT);
        def(LDVAR, "ldvar", IMM_SYMBOL);
        def(LDDDVAR, "ldddvar", IMM_SYMBOL);
        def(LDFUN, "ldfun", IMM_SYMBOL);
        def(STVAR, "stvar", IMM_SYMBOL);
        def(IS, "is", IMM_TYPE);
        def(ISFUN, "isfun");
        def(STARTASSIGN, "startassign", IMM_SYMBOL);
        def(PROMISE, "promise", IMM_CODE);
        def(PUSH_CODE, "push_code", IMM_CODE);
        def(FORCE, "force");
        def(CLOSE, "close", IMM_FUNCTION);
        def(BR, "br", IMM_JUMP);
        def(BRTRUE, "brtrue", IMM_JUMP);
        def(BRFALSE, "brfalse", IMM_JUMP);
        def(BROBJ, "brobj", IMM_JUMP);
        def(BRNOTNUM, "brnotnum", IMM_JUMP);
        def(BEGINLOOP, "beginloop", IMM_JUMP);
        def(ENDCONTEXT, "endcontext");
        def(RET, "ret");
        def(CALL, "call", IMM_ARGS, IMM_NAMES);
        def(CALL_STACK, "call_stack", IMM_INT, IMM_NAMES);
        def(DISPATCH, "dispatch", IMM_ARGS, IMM_NAMES, IMM_SYMBOL);
        def(DISPATCH_STACK, "dispatch_stack", IMM_INT, IMM_NAMES, IMM_SYMBOL);
        def(ASBOOL, "asbool");
        def(ASLOGICAL, "aslogical");
        def(LGL_AND, "lgl_and");
        def(LGL_OR, "lgl_or");
        def(ADD, "add");
        def(SUB, "sub");
        def(MUL, "mul");
        def(LT, "lt");
        def(INC, "inc");
        def(EXTRACT1, "extract1");
        def(SUBSET1, "subset1");
        def(TEST_BOUNDS, "test_bounds");
        def(UNIQ, "uniq");
        def(INVISIBLE, "invisible");
        def(VISIBLE, "visible");
    }

    private static void def(short opcode, String name, int... immediates) {
        NAMES[opcode] = name;
        IMMEDIATES[opcode] = immediates;
    }

    public static boolean isValid(int opcode) {
        return opcode > 0 && opcode < MAX_OPCODE && NAMES[opcode] != null;
    }

    public static String name(int opcode) {
        return isValid(opcode) ? NAMES[opcode] : "<bad opcode " + opcode + ">";
    }

    /**
     * Immediate kinds of the opcode, in encoding order.
     */
    public static int[] immediates(int opcode) {
        return IMMEDIATES[opcode];
    }

    /**
     * Total instruction width in slots.
     */
    public static int length(int opcode) {
        return 1 + IMMEDIATES[opcode].length;
    }

    public static boolean isJump(int opcode) {
        int[] imm = IMMEDIATES[opcode];
        return imm.length == 1 && imm[0] == IMM_JUMP;
    }
}
