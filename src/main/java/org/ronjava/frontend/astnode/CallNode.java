package org.ronjava.frontend.astnode;

import org.ronjava.frontend.analysis.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A call-shaped node: a function expression applied to an ordered list of
 * optionally named arguments. Operators, blocks, loops and assignments are all
 * calls; the compiler decides which of them are special forms.
 */
public class CallNode extends AbstractNode {
    public final Node function;
    public final List<Argument> args;

    public CallNode(Node function, List<Argument> args) {
        this(function, args, -1);
    }

    public CallNode(Node function, List<Argument> args, int tokenIndex) {
        this.function = function;
        this.args = List.copyOf(args);
        this.tokenIndex = tokenIndex;
    }

    /**
     * Returns the callee name when the function is a plain symbol, otherwise null.
     */
    public String functionName() {
        return function instanceof SymbolNode sym ? sym.name : null;
    }

    public Node arg(int i) {
        return args.get(i).value;
    }

    public int argCount() {
        return args.size();
    }

    public boolean hasNames() {
        for (Argument arg : args) {
            if (arg.name != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when any argument is the variadic marker or the empty argument.
     */
    public boolean hasDotsOrMissing() {
        for (Argument arg : args) {
            if (arg.isDots() || arg.value instanceof MissingArgNode) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of this call with a different function and argument list,
     * keeping the source position.
     */
    public CallNode withArgs(Node newFunction, List<Argument> newArgs) {
        return new CallNode(newFunction, newArgs, tokenIndex);
    }

    public List<Argument> copyArgs() {
        return new ArrayList<>(args);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * One actual argument. {@code name} is null for positional arguments.
     */
    public static final class Argument {
        public final String name;
        public final Node value;

        public Argument(String name, Node value) {
            this.name = name;
            this.value = value;
        }

        public static Argument positional(Node value) {
            return new Argument(null, value);
        }

        public boolean isDots() {
            return value instanceof SymbolNode sym && sym.isDots();
        }
    }
}
