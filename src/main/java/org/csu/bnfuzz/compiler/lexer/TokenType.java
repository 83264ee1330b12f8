package org.csu.bnfuzz.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 语法文件中一行可能出现的所有“单词”的分类。
 */
public enum TokenType {
    // ---- 特殊 Token ----
    EOL("end of line"),

    // ---- 符号名 ----
    SYMBOL("symbol"),

    // ---- 定义 ----
    DEFINITION("definition symbol"),                    // ::= 或 =
    INCREMENTAL_ALTERNATIVE("incremental alternative"), // =/

    // ---- 选择 ----
    ALTERNATION("alternation symbol"), // | 或 /

    // ---- 常量 ----
    STRING("string literal"),
    NUMBER("number"),
    VALUE_RANGE("value range"), // %x30-39

    // ---- 分隔符 ----
    BRACKET_OPEN("open bracket"),   // [
    BRACKET_CLOSE("close bracket"), // ]
    CURLY_OPEN("open curly"),       // {
    CURLY_CLOSE("close curly"),     // }
    PAREN_OPEN("open paren"),       // (
    PAREN_CLOSE("close paren"),     // )
    ELLIPSIS("ellipsis"),           // ...
    DASH("dash"),                   // -
    ASTERISK("asterisk");           // *

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
