package org.ronjava.runtime.runtimetypes;

import org.ronjava.frontend.astnode.Node;

import java.io.Serial;

/**
 * Raised while compiling. Reported against the offending source expression;
 * compilation of the enclosing code object is abandoned.
 */
public class RCompilerException extends RError {
    @Serial
    private static final long serialVersionUID = 1L;

    public RCompilerException(ErrorKind kind, String detail, Node source) {
        super(kind, detail, source);
    }
}
