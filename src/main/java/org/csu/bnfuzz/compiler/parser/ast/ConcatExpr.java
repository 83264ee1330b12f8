package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

import java.util.List;

/**
 * AST 节点: 顺序拼接
 */
public record ConcatExpr(Loc loc, List<Expr> elements) implements Expr {

    public ConcatExpr {
        elements = List.copyOf(elements);
    }
}
