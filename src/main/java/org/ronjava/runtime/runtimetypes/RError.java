package org.ronjava.runtime.runtimetypes;

import org.ronjava.frontend.analysis.PrintVisitor;
import org.ronjava.frontend.astnode.Node;

import java.io.Serial;

/**
 * A run-time error. Fatal to the current evaluation; it unwinds every open
 * control context on its way to the nearest handler.
 * <p>
 * The message is formatted as {@code Error in <call> : <detail>}, or
 * {@code Error: <detail>} when no call is known.
 */
public class RError extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;
    private transient Node call;

    public RError(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public RError(ErrorKind kind, String detail, Node call) {
        super(detail);
        this.kind = kind;
        this.detail = detail;
        this.call = call;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }

    public Node call() {
        return call;
    }

    /**
     * Records the call the error was raised in, unless one is already known.
     */
    public RError attachCall(Node node) {
        if (call == null) {
            call = node;
        }
        return this;
    }

    @Override
    public String getMessage() {
        if (call == null) {
            return "Error: " + detail;
        }
        return "Error in " + PrintVisitor.deparse(call) + " : " + detail;
    }
}
