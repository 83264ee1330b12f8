package org.csu.bnfuzz.common.exception;

import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.common.model.Loc;

/**
 * 所有携带 {@link Diagnostic} 的异常的基类。
 */
public abstract class DiagnosticException extends RuntimeException {

    private final Diagnostic diagnostic;

    protected DiagnosticException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    protected DiagnosticException(Loc loc, String message) {
        this(Diagnostic.error(loc, message));
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
