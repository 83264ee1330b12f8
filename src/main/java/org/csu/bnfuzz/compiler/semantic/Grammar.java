package org.csu.bnfuzz.compiler.semantic;

import org.csu.bnfuzz.common.exception.SemanticException;
import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.compiler.parser.ast.AlternationExpr;
import org.csu.bnfuzz.compiler.parser.ast.Expr;
import org.csu.bnfuzz.compiler.parser.ast.Rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 规则表
 *
 * 以规则名为键保存所有规则。规则只会被定义一次，之后可以通过 =/ 追加选择分支，但永远不会被删除。
 */
public class Grammar {

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    /**
     * 定义一条新规则 (::= 或 =)。同名规则已存在时抛出异常，并指出两处定义的位置。
     */
    public void define(Rule rule) {
        Rule existing = rules.get(rule.name());
        if (existing != null) {
            Diagnostic diagnostic = Diagnostic.error(rule.head().loc(), "Redefinition of the rule " + rule.name())
                    .withNote(existing.head().loc(), "The first definition is located here");
            throw new SemanticException(diagnostic);
        }
        rules.put(rule.name(), rule);
    }

    /**
     * 为已有规则追加选择分支 (=/)。
     * 原规则体若不是选择表达式，先提升为只有一个分支的选择，再追加。
     */
    public void extend(Rule rule) {
        Rule existing = rules.get(rule.name());
        if (existing == null) {
            throw new SemanticException(rule.head().loc(),
                    "Incremental alternative for the rule " + rule.name() + " that is not defined yet");
        }

        List<Expr> variants = new ArrayList<>();
        Expr body = existing.body();
        if (body instanceof AlternationExpr alternation) {
            variants.addAll(alternation.variants());
        } else {
            variants.add(body);
        }
        if (rule.body() instanceof AlternationExpr added) {
            variants.addAll(added.variants());
        } else {
            variants.add(rule.body());
        }

        rules.put(existing.name(), new Rule(existing.head(), new AlternationExpr(body.loc(), variants)));
    }

    /**
     * @return 规则，不存在时返回 null
     */
    public Rule getRule(String name) {
        return rules.get(name);
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    public Collection<Rule> getRules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    public Set<String> getRuleNames() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    public int size() {
        return rules.size();
    }
}
