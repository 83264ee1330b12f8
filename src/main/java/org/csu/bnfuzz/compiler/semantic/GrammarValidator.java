package org.csu.bnfuzz.compiler.semantic;

import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.compiler.parser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 语法的静态检查
 *
 * 两项互相独立的只读检查，都会报告发现的全部问题而不是第一处:
 * 1. 引用了未定义的符号;
 * 2. 从入口规则出发无法到达的规则。
 */
public class GrammarValidator {

    /**
     * 检查所有规则体中引用的符号是否都已定义
     */
    public List<Diagnostic> validateDefined(Grammar grammar) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Rule rule : grammar.getRules()) {
            collectUndefined(grammar, rule.body(), diagnostics);
        }
        return diagnostics;
    }

    private void collectUndefined(Grammar grammar, Expr expr, List<Diagnostic> diagnostics) {
        if (expr instanceof SymbolExpr symbol) {
            if (!grammar.contains(symbol.name())) {
                diagnostics.add(Diagnostic.error(symbol.loc(), "Symbol <" + symbol.name() + "> is not defined"));
            }
        } else if (expr instanceof ConcatExpr concat) {
            for (Expr element : concat.elements()) {
                collectUndefined(grammar, element, diagnostics);
            }
        } else if (expr instanceof AlternationExpr alternation) {
            for (Expr variant : alternation.variants()) {
                collectUndefined(grammar, variant, diagnostics);
            }
        } else if (expr instanceof RepetitionExpr repetition) {
            collectUndefined(grammar, repetition.body(), diagnostics);
        } else if (!(expr instanceof StringExpr) && !(expr instanceof RangeExpr)) {
            throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getName());
        }
    }

    /**
     * 报告从 entry 出发无法到达的规则
     */
    public List<Diagnostic> validateReachable(Grammar grammar, String entry) {
        Set<String> reachable = collectReachable(grammar, entry);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Rule rule : grammar.getRules()) {
            if (!reachable.contains(rule.name())) {
                diagnostics.add(Diagnostic.error(rule.head().loc(), "Symbol <" + rule.name() + "> is unused"));
            }
        }
        return diagnostics;
    }

    /**
     * 深度优先遍历符号引用。已访问过的规则不再展开，因此在有环的语法上也能终止。
     * 未定义的符号会被跳过，它们由 {@link #validateDefined(Grammar)} 负责报告。
     */
    public Set<String> collectReachable(Grammar grammar, String entry) {
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(entry);

        while (!pending.isEmpty()) {
            String name = pending.pop();
            Rule rule = grammar.getRule(name);
            if (rule == null || !visited.add(name)) {
                continue;
            }
            List<String> referenced = new ArrayList<>();
            collectSymbols(rule.body(), referenced);
            for (String next : referenced) {
                if (!visited.contains(next)) {
                    pending.push(next);
                }
            }
        }
        return visited;
    }

    private void collectSymbols(Expr expr, List<String> names) {
        if (expr instanceof SymbolExpr symbol) {
            names.add(symbol.name());
        } else if (expr instanceof ConcatExpr concat) {
            for (Expr element : concat.elements()) {
                collectSymbols(element, names);
            }
        } else if (expr instanceof AlternationExpr alternation) {
            for (Expr variant : alternation.variants()) {
                collectSymbols(variant, names);
            }
        } else if (expr instanceof RepetitionExpr repetition) {
            collectSymbols(repetition.body(), names);
        } else if (!(expr instanceof StringExpr) && !(expr instanceof RangeExpr)) {
            throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getName());
        }
    }
}
