package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

import java.util.List;

/**
 * AST 节点: 互斥选择，生成时等概率选其一
 */
public record AlternationExpr(Loc loc, List<Expr> variants) implements Expr {

    public AlternationExpr {
        variants = List.copyOf(variants);
    }
}
