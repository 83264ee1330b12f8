package org.csu.bnfuzz.engine;

import org.csu.bnfuzz.common.exception.GenerationException;
import org.csu.bnfuzz.compiler.parser.ast.*;
import org.csu.bnfuzz.compiler.semantic.Grammar;

import java.util.Random;

/**
 * @author hidyouth
 * @description: 随机消息生成器
 *
 * 递归地遍历 AST 产生符合语法的随机文本。所有随机抽取 (选择分支、重复次数、范围内的字符)
 * 都按生成顺序消耗同一个 {@link Random}，因此固定种子时结果可复现。
 *
 * 注意: 不对递归深度设限。一个没有终止分支的自递归规则会导致无限递归。
 */
public class MessageGenerator {

    private final Grammar grammar;
    private final Random random;

    public MessageGenerator(Grammar grammar, Random random) {
        this.grammar = grammar;
        this.random = random;
    }

    /**
     * 从入口规则生成一条消息
     */
    public String generate(String entry) {
        Rule rule = grammar.getRule(entry);
        if (rule == null) {
            throw new GenerationException(null, "Symbol <" + entry + "> is not defined");
        }
        return expand(rule.body());
    }

    public String expand(Expr expr) {
        StringBuilder message = new StringBuilder();
        expandInto(expr, message);
        return message.toString();
    }

    private void expandInto(Expr expr, StringBuilder message) {
        if (expr instanceof StringExpr string) {
            message.append(string.text());
        } else if (expr instanceof SymbolExpr symbol) {
            Rule rule = grammar.getRule(symbol.name());
            if (rule == null) {
                throw new GenerationException(symbol.loc(), "Symbol <" + symbol.name() + "> is not defined");
            }
            expandInto(rule.body(), message);
        } else if (expr instanceof ConcatExpr concat) {
            for (Expr element : concat.elements()) {
                expandInto(element, message);
            }
        } else if (expr instanceof AlternationExpr alternation) {
            int index = random.nextInt(alternation.variants().size());
            expandInto(alternation.variants().get(index), message);
        } else if (expr instanceof RepetitionExpr repetition) {
            if (repetition.lower() > repetition.upper()) {
                throw new GenerationException(repetition.loc(), String.format(
                        "Lower bound of the repetition (%d) is greater than the upper bound (%d)",
                        repetition.lower(), repetition.upper()));
            }
            int count = drawInclusive(repetition.lower(), repetition.upper());
            for (int i = 0; i < count; i++) {
                expandInto(repetition.body(), message);
            }
        } else if (expr instanceof RangeExpr range) {
            if (range.lower() > range.upper()) {
                throw new GenerationException(range.loc(), String.format(
                        "Lower bound of the range (U+%04X) is greater than the upper bound (U+%04X)",
                        range.lower(), range.upper()));
            }
            message.appendCodePoint(drawInclusive(range.lower(), range.upper()));
        } else {
            throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getName());
        }
    }

    /**
     * 在 [lower, upper] 内等概率取值。以 long 计算区间宽度，0..Integer.MAX_VALUE 也不会溢出。
     */
    private int drawInclusive(int lower, int upper) {
        return (int) random.nextLong(lower, upper + 1L);
    }
}
