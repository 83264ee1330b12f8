package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

/**
 * AST 节点: 原样输出的字符串字面量
 */
public record StringExpr(Loc loc, String text) implements Expr {
}
