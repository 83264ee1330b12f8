package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.compiler.lexer.Token;
import org.csu.bnfuzz.compiler.lexer.TokenType;

/**
 * 解析出的一行规则，连同它所使用的定义符号 (::= / = 或 =/)。
 */
public record RuleDefinition(Rule rule, Token definition) {

    public boolean isIncremental() {
        return definition.type() == TokenType.INCREMENTAL_ALTERNATIVE;
    }
}
