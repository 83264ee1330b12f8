package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

/**
 * AST 节点: 闭区间字符范围 (e.g., "a" ... "z" 或 %x30-39)。
 * 上下界均为码点; lower &lt;= upper 直到生成时才检查。
 */
public record RangeExpr(Loc loc, int lower, int upper) implements Expr {
}
