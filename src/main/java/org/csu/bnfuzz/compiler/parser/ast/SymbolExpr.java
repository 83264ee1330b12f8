package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

/**
 * AST 节点: 对另一条规则的引用 (e.g., &lt;digit&gt;)
 */
public record SymbolExpr(Loc loc, String name) implements Expr {
}
