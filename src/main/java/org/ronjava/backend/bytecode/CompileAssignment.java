package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RCompilerException;
import org.ronjava.runtime.runtimetypes.RString;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles {@code <-} and {@code =}.
 * <p>
 * A plain target stores the value. A call target such as {@code names(x$a) <- v}
 * is taken apart into a chain of getter calls ending in the target symbol, and
 * compiled as
 * <pre>
 *   *tmp* &lt;- x
 *   t &lt;- `$`(*tmp*, a)
 *   x &lt;- `$&lt;-`(*tmp*, a, value = `names&lt;-`(t, value = v))
 * </pre>
 * without materializing {@code *tmp*}: intermediates stay on the operand stack and
 * stack calls fill the placeholders.
 */
final class CompileAssignment {

    /** Placeholder for the object argument of a replayed getter or setter call. */
    static final String OBJECT_PLACEHOLDER = "*tmp*";
    /** Placeholder for the {@code value} argument of a setter call. */
    static final String VALUE_PLACEHOLDER = "*vtmp*";

    private CompileAssignment() {
    }

    static void compileAssignment(BytecodeCompiler compiler, CallNode call) {
        Node lhs = call.arg(0);
        Node rhs = call.arg(1);
        String target = targetName(lhs);
        if (target != null) {
            CodeStream cs = compiler.cs();
            compiler.compileExpr(rhs);
            cs.emit(Opcodes.DUP);
            cs.emit(Opcodes.STVAR, compiler.symbol(target)).addSource(compiler.source(call));
            cs.emit(Opcodes.INVISIBLE);
            return;
        }
        if (lhs instanceof CallNode lhsCall) {
            compileComplexAssignment(compiler, call, lhsCall, rhs);
            return;
        }
        throw new RCompilerException(ErrorKind.INVALID_ASSIGNMENT_TARGET, "invalid assignment target", call);
    }

    /**
     * The symbol an assignment stores into: a plain symbol or a single string.
     */
    static String targetName(Node lhs) {
        if (lhs instanceof SymbolNode sym) {
            return sym.isDots() || sym.dotDotIndex() > 0 ? null : sym.name;
        }
        if (lhs instanceof ConstantNode c && c.value instanceof RString s
                && s.length() == 1 && !s.hasAttributes() && s.values[0] != null) {
            return s.values[0].intern();
        }
        return null;
    }

    private static void compileComplexAssignment(BytecodeCompiler compiler, CallNode assignment,
                                                 CallNode lhs, Node rhs) {
        // outermost call first
        List<CallNode> chain = new ArrayList<>();
        Node part = lhs;
        while (part instanceof CallNode c) {
            checkLink(c, assignment);
            chain.add(c);
            part = c.arg(0);
        }
        String target = targetName(part);
        if (target == null) {
            throw new RCompilerException(ErrorKind.INVALID_ASSIGNMENT_TARGET,
                    "invalid assignment target", assignment);
        }

        CodeStream cs = compiler.cs();
        int links = chain.size();

        // v v x
        compiler.compileExpr(rhs);
        cs.emit(Opcodes.DUP);
        cs.emit(Opcodes.STARTASSIGN, compiler.symbol(target)).addSource(compiler.source(part));
        cs.emit(Opcodes.UNIQ);

        // v v x t2 .. tk
        for (int i = links - 1; i > 0; i--) {
            CallNode getter = chain.get(i);
            cs.emit(Opcodes.DUP);
            cs.emit(Opcodes.LDFUN, compiler.symbol(getter.functionName())).addSource(compiler.source(getter));
            cs.emit(Opcodes.SWAP);
            String[] names = new String[getter.argCount()];
            names[0] = getter.args.get(0).name;
            for (int a = 1; a < getter.argCount(); a++) {
                compiler.compileStackArg(getter.arg(a));
                names[a] = getter.args.get(a).name;
            }
            cs.emit(Opcodes.CALL_STACK, getter.argCount(), compiler.namesIndex(names))
                    .addSource(compiler.source(getterShape(getter)));
            cs.emit(Opcodes.UNIQ);
        }

        // v x t2 .. tk v
        cs.emit(Opcodes.PICK, links);

        // innermost setter first; each leaves the updated object for the next one
        for (int i = 0; i < links; i++) {
            CallNode link = chain.get(i);
            String setterName = link.functionName() + "<-";
            int extra = link.argCount() - 1;
            cs.emit(Opcodes.LDFUN, compiler.symbol(setterName)).addSource(compiler.source(link));
            cs.emit(Opcodes.PUT, 2);
            String[] names = new String[extra + 2];
            names[0] = link.args.get(0).name;
            for (int a = 1; a <= extra; a++) {
                compiler.compileStackArg(link.arg(a));
                names[a] = link.args.get(a).name;
            }
            if (extra > 0) {
                cs.emit(Opcodes.PICK, extra);
            }
            names[extra + 1] = "value";
            cs.emit(Opcodes.CALL_STACK, extra + 2, compiler.namesIndex(names))
                    .addSource(compiler.source(setterShape(link, setterName)));
        }

        cs.emit(Opcodes.STVAR, compiler.symbol(target)).addSource(compiler.source(assignment));
        cs.emit(Opcodes.INVISIBLE);
    }

    private static void checkLink(CallNode link, CallNode assignment) {
        if (link.functionName() == null || link.function instanceof SymbolNode s && s.isDots()) {
            throw new RCompilerException(ErrorKind.INVALID_ASSIGNMENT_TARGET,
                    "invalid function in complex assignment", assignment);
        }
        if (link.argCount() == 0 || link.args.get(0).isDots() || link.arg(0) instanceof MissingArgNode) {
            throw new RCompilerException(ErrorKind.INVALID_ASSIGNMENT_TARGET,
                    "invalid assignment target", assignment);
        }
        for (CallNode.Argument arg : link.args) {
            if (arg.isDots()) {
                throw new RCompilerException(ErrorKind.INVALID_ASSIGNMENT_TARGET,
                        "'...' in an assignment target is not supported", assignment);
            }
        }
    }

    // f(*tmp*, args..)
    private static CallNode getterShape(CallNode getter) {
        List<CallNode.Argument> args = getter.copyArgs();
        args.set(0, new CallNode.Argument(args.get(0).name, new SymbolNode(OBJECT_PLACEHOLDER)));
        return getter.withArgs(getter.function, args);
    }

    // `f<-`(*tmp*, args.., value = *vtmp*)
    private static CallNode setterShape(CallNode link, String setterName) {
        List<CallNode.Argument> args = link.copyArgs();
        args.set(0, new CallNode.Argument(args.get(0).name, new SymbolNode(OBJECT_PLACEHOLDER)));
        args.add(new CallNode.Argument("value", new SymbolNode(VALUE_PLACEHOLDER)));
        return link.withArgs(new SymbolNode(setterName), args);
    }
}
