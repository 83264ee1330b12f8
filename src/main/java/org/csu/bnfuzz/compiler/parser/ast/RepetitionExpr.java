package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

/**
 * AST 节点: 重复 body 若干次，次数落在 [lower, upper] 内。
 * 与 {@link RangeExpr} 一样，上下界的大小关系在生成时才检查。
 */
public record RepetitionExpr(Loc loc, Expr body, int lower, int upper) implements Expr {
}
