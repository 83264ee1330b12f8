package org.csu.bnfuzz.compiler.parser.ast;

import org.csu.bnfuzz.common.model.Loc;

/**
 * AST 节点: 语法规则右部的表达式。
 *
 * 封闭的六种变体; 每个节点独占自己的子节点，AST 本身不会成环，
 * 环只会经由符号引用在规则表中间接出现。
 */
public sealed interface Expr
        permits SymbolExpr, StringExpr, RangeExpr, ConcatExpr, AlternationExpr, RepetitionExpr {

    Loc loc();
}
