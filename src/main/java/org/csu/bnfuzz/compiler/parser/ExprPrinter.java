package org.csu.bnfuzz.compiler.parser;

import org.csu.bnfuzz.compiler.parser.ast.*;

/**
 * 将 AST 还原为语法文件中的文本形式，用于 -dump。
 * 输出可以被 {@link Parser} 重新解析为等价的表达式。
 */
public class ExprPrinter {

    private final int defaultMaxRepetition;

    public ExprPrinter() {
        this(Parser.DEFAULT_MAX_REPETITION);
    }

    public ExprPrinter(int defaultMaxRepetition) {
        this.defaultMaxRepetition = defaultMaxRepetition;
    }

    public String print(Rule rule) {
        return "<" + rule.name() + "> ::= " + print(rule.body());
    }

    public String print(Expr expr) {
        StringBuilder sb = new StringBuilder();
        append(sb, expr);
        return sb.toString();
    }

    private void append(StringBuilder sb, Expr expr) {
        if (expr instanceof SymbolExpr symbol) {
            sb.append('<').append(symbol.name()).append('>');
        } else if (expr instanceof StringExpr string) {
            appendQuoted(sb, string.text());
        } else if (expr instanceof RangeExpr range) {
            appendRange(sb, range);
        } else if (expr instanceof ConcatExpr concat) {
            for (int i = 0; i < concat.elements().size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                Expr element = concat.elements().get(i);
                if (element instanceof AlternationExpr || element instanceof ConcatExpr) {
                    appendGrouped(sb, element);
                } else {
                    append(sb, element);
                }
            }
        } else if (expr instanceof AlternationExpr alternation) {
            for (int i = 0; i < alternation.variants().size(); i++) {
                if (i > 0) {
                    sb.append(" | ");
                }
                Expr variant = alternation.variants().get(i);
                if (variant instanceof AlternationExpr) {
                    appendGrouped(sb, variant);
                } else {
                    append(sb, variant);
                }
            }
        } else if (expr instanceof RepetitionExpr repetition) {
            appendRepetition(sb, repetition);
        } else {
            throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getName());
        }
    }

    private void appendRepetition(StringBuilder sb, RepetitionExpr repetition) {
        if (repetition.lower() == 0 && repetition.upper() == 1) {
            sb.append('[');
            append(sb, repetition.body());
            sb.append(']');
            return;
        }
        if (repetition.lower() == 0 && repetition.upper() == defaultMaxRepetition) {
            sb.append('{');
            append(sb, repetition.body());
            sb.append('}');
            return;
        }

        if (repetition.lower() == repetition.upper()) {
            sb.append(repetition.lower()).append(' ');
        } else {
            sb.append(repetition.lower()).append('*').append(repetition.upper()).append(' ');
        }
        Expr body = repetition.body();
        if (body instanceof ConcatExpr || body instanceof AlternationExpr || body instanceof RepetitionExpr) {
            appendGrouped(sb, body);
        } else {
            append(sb, body);
        }
    }

    private void appendGrouped(StringBuilder sb, Expr expr) {
        sb.append('(');
        append(sb, expr);
        sb.append(')');
    }

    private void appendRange(StringBuilder sb, RangeExpr range) {
        boolean printable = isPrintable(range.lower()) && isPrintable(range.upper());
        if (!printable && range.lower() <= 0xFF && range.upper() <= 0xFF) {
            sb.append(String.format("%%x%02X-%02X", range.lower(), range.upper()));
        } else {
            appendQuoted(sb, new String(Character.toChars(range.lower())));
            sb.append(" ... ");
            appendQuoted(sb, new String(Character.toChars(range.upper())));
        }
    }

    private static void appendQuoted(StringBuilder sb, String text) {
        sb.append('"');
        text.codePoints().forEach(ch -> {
            switch (ch) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case 0 -> sb.append("\\0");
                default -> {
                    if (ch <= 0xFF && Character.isISOControl(ch)) {
                        sb.append(String.format("\\x%02X", ch));
                    } else {
                        sb.appendCodePoint(ch);
                    }
                }
            }
        });
        sb.append('"');
    }

    private static boolean isPrintable(int ch) {
        return !Character.isISOControl(ch) && !Character.isWhitespace(ch);
    }
}
