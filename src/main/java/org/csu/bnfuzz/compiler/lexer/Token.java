package org.csu.bnfuzz.compiler.lexer;

import org.csu.bnfuzz.common.model.Loc;

/**
 * @param type   词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本
 * @param text   解码后的内容: 符号名、转义后的字符串、值域的上下界 (两个码点)
 * @param number 数字常量的值，其它类型为 0
 * @param loc    所在位置
 */
public record Token(TokenType type, String lexeme, String text, int number, Loc loc) {

    public static Token of(TokenType type, String lexeme, Loc loc) {
        return new Token(type, lexeme, lexeme, 0, loc);
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-23s, Lexeme='%s', Position=%s]", type, lexeme, loc);
    }
}
