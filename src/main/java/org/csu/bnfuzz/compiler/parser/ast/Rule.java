package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.compiler.lexer.Token;

/**
 * 一条语法规则: head 为定义它的符号 Token，body 为右部表达式。
 */
public record Rule(Token head, Expr body) {

    public String name() {
        return head.text();
    }
}
