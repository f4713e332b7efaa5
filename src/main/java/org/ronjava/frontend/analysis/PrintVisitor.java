package org.ronjava.frontend.analysis;

import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.FunctionNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.RPromise;

import java.util.Set;
import java.util.regex.Pattern;

/*
 * Deparses an expression tree back to surface syntax.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   node.accept(printVisitor);
 *   return printVisitor.getResult();
 */
public class PrintVisitor implements Visitor {

    private static final Set<String> SPACED_BINARY = Set.of(
            "+", "-", "*", "/", "^", "<", ">", "<=", ">=", "==", "!=",
            "&&", "||", "&", "|", "<-", "<<-", "=", "~", "%%", "%in%");
    private static final Set<String> TIGHT_BINARY = Set.of("$", "@", ":", "::");
    private static final Pattern SYNTACTIC = Pattern.compile("^((\\.[A-Za-z._]|[A-Za-z])[A-Za-z0-9._]*|\\.|\\.\\.\\.|\\.\\.[0-9]+)$");

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public static String deparse(Node node) {
        PrintVisitor printVisitor = new PrintVisitor();
        node.accept(printVisitor);
        return printVisitor.getResult();
    }

    public static String quoteSymbol(String name) {
        return SYNTACTIC.matcher(name).matches() ? name : "`" + name + "`";
    }

    public String getResult() {
        return sb.toString();
    }

    private void appendIndent() {
        sb.append("    ".repeat(Math.max(0, indentLevel)));
    }

    @Override
    public void visit(SymbolNode node) {
        sb.append(quoteSymbol(node.name));
    }

    @Override
    public void visit(ConstantNode node) {
        if (node.value instanceof RPromise promise && !promise.isForced()) {
            promise.expression().accept(this);
            return;
        }
        sb.append(node.value.deparse());
    }

    @Override
    public void visit(MissingArgNode node) {
        // the empty argument prints as nothing
    }

    @Override
    public void visit(FunctionNode node) {
        sb.append("function(");
        for (int i = 0; i < node.formals.size(); i++) {
            FunctionNode.Formal formal = node.formals.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(quoteSymbol(formal.name));
            if (formal.defaultValue != null) {
                sb.append(" = ");
                formal.defaultValue.accept(this);
            }
        }
        sb.append(") ");
        node.body.accept(this);
    }

    @Override
    public void visit(CallNode node) {
        String name = node.functionName();
        int n = node.argCount();
        if (name != null && !node.hasNames()) {
            if (n == 2 && SPACED_BINARY.contains(name)) {
                node.arg(0).accept(this);
                sb.append(' ').append(name).append(' ');
                node.arg(1).accept(this);
                return;
            }
            if (n == 2 && TIGHT_BINARY.contains(name)) {
                node.arg(0).accept(this);
                sb.append(name);
                node.arg(1).accept(this);
                return;
            }
            if (n == 1 && (name.equals("-") || name.equals("+") || name.equals("!"))) {
                sb.append(name);
                node.arg(0).accept(this);
                return;
            }
            switch (name) {
                case "{" -> {
                    printBlock(node);
                    return;
                }
                case "(" -> {
                    if (n == 1) {
                        sb.append('(');
                        node.arg(0).accept(this);
                        sb.append(')');
                        return;
                    }
                }
                case "if" -> {
                    if (n == 2 || n == 3) {
                        sb.append("if (");
                        node.arg(0).accept(this);
                        sb.append(") ");
                        node.arg(1).accept(this);
                        if (n == 3) {
                            sb.append(" else ");
                            node.arg(2).accept(this);
                        }
                        return;
                    }
                }
                case "while" -> {
                    if (n == 2) {
                        sb.append("while (");
                        node.arg(0).accept(this);
                        sb.append(") ");
                        node.arg(1).accept(this);
                        return;
                    }
                }
                case "repeat" -> {
                    if (n == 1) {
                        sb.append("repeat ");
                        node.arg(0).accept(this);
                        return;
                    }
                }
                case "for" -> {
                    if (n == 3) {
                        sb.append("for (");
                        node.arg(0).accept(this);
                        sb.append(" in ");
                        node.arg(1).accept(this);
                        sb.append(") ");
                        node.arg(2).accept(this);
                        return;
                    }
                }
                case "break", "next" -> {
                    if (n == 0) {
                        sb.append(name);
                        return;
                    }
                }
                default -> {
                }
            }
        }
        if ("[".equals(name) || "[[".equals(name)) {
            if (n >= 1) {
                node.arg(0).accept(this);
                sb.append(name);
                printArgs(node, 1);
                sb.append("[".equals(name) ? "]" : "]]");
                return;
            }
        }
        if (node.function instanceof SymbolNode || node.function instanceof CallNode) {
            node.function.accept(this);
        } else {
            sb.append('(');
            node.function.accept(this);
            sb.append(')');
        }
        sb.append('(');
        printArgs(node, 0);
        sb.append(')');
    }

    private void printArgs(CallNode node, int from) {
        for (int i = from; i < node.argCount(); i++) {
            if (i > from) {
                sb.append(", ");
            }
            CallNode.Argument arg = node.args.get(i);
            if (arg.name != null) {
                sb.append(quoteSymbol(arg.name)).append(" = ");
            }
            arg.value.accept(this);
        }
    }

    private void printBlock(CallNode node) {
        sb.append("{\n");
        indentLevel++;
        for (CallNode.Argument arg : node.args) {
            appendIndent();
            arg.value.accept(this);
            sb.append('\n');
        }
        indentLevel--;
        appendIndent();
        sb.append('}');
    }
}
