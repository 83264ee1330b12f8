package org.csu.bnfuzz.common.exception;

import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.common.model.Loc;

/**
 * @author hidyouth
 * @description: 规则表操作的语义异常 (重复定义、对未定义符号使用 =/)
 */
public class SemanticException extends DiagnosticException {

    public SemanticException(Loc loc, String message) {
        super(loc, message);
    }

    public SemanticException(Diagnostic diagnostic) {
        super(diagnostic);
    }
}
