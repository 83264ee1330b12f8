package org.csu.bnfuzz.common.exception;

import org.csu.bnfuzz.common.model.Loc;
import org.csu.bnfuzz.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 词法与语法分析阶段的异常
 */
public class ParseException extends DiagnosticException {

    public ParseException(Loc loc, String message) {
        super(loc, message);
    }

    public ParseException(Token token, String expected) {
        super(token.loc(), String.format("Expected %s but got %s", expected, token.type().description()));
    }
}
