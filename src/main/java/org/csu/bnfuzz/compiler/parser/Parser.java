package org.csu.bnfuzz.compiler.parser;

import org.csu.bnfuzz.common.exception.ParseException;
import org.csu.bnfuzz.compiler.lexer.Lexer;
import org.csu.bnfuzz.compiler.lexer.Token;
import org.csu.bnfuzz.compiler.lexer.TokenType;
import org.csu.bnfuzz.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，从 Lexer 按需读取 Token 并构建表达式的抽象语法树(AST)。
 *
 * 优先级由低到高:
 * <pre>
 * Alt     → Concat ( ('|' | '/') Concat )*
 * Concat  → Primary Primary*
 * Primary → ( Alt ) | { Alt } | [ Alt ] | symbol | string | string ... string
 *         | %xHH-HH | * [n] Primary | n Primary | n * [m] Primary
 * </pre>
 */
public class Parser {

    /**
     * {} 与不带上界的 * 所使用的默认重复上限
     */
    public static final int DEFAULT_MAX_REPETITION = 20;

    private static final Set<TokenType> PRIMARY_START = Set.of(
            TokenType.SYMBOL, TokenType.STRING, TokenType.BRACKET_OPEN, TokenType.CURLY_OPEN,
            TokenType.PAREN_OPEN, TokenType.NUMBER, TokenType.ASTERISK, TokenType.VALUE_RANGE
    );

    private final Lexer lexer;
    private final int defaultMaxRepetition;

    public Parser(Lexer lexer) {
        this(lexer, DEFAULT_MAX_REPETITION);
    }

    public Parser(Lexer lexer, int defaultMaxRepetition) {
        this.lexer = lexer;
        this.defaultMaxRepetition = defaultMaxRepetition;
    }

    public static boolean isPrimaryStart(TokenType type) {
        return PRIMARY_START.contains(type);
    }

    /**
     * 解析一条规则: SYMBOL ( "::=" | "=" | "=/" ) EXPRESSION。
     * 行尾由调用方检查。
     */
    public RuleDefinition parseRule() {
        Token head = consume(TokenType.SYMBOL, TokenType.SYMBOL.description());
        Token definition = lexer.next();
        if (definition.type() != TokenType.DEFINITION && definition.type() != TokenType.INCREMENTAL_ALTERNATIVE) {
            throw new ParseException(definition, TokenType.DEFINITION.description());
        }
        Expr body = parseExpr();
        return new RuleDefinition(new Rule(head, body), definition);
    }

    public void expectEndOfLine() {
        consume(TokenType.EOL, TokenType.EOL.description());
    }

    public Expr parseExpr() {
        return parseAlternation();
    }

    private Expr parseAlternation() {
        Expr first = parseConcatenation();
        if (!check(TokenType.ALTERNATION)) {
            return first;
        }

        List<Expr> variants = new ArrayList<>();
        variants.add(first);
        while (match(TokenType.ALTERNATION)) {
            variants.add(parseConcatenation());
        }
        return new AlternationExpr(first.loc(), variants);
    }

    private Expr parseConcatenation() {
        Expr first = parsePrimary();
        if (!isPrimaryStart(lexer.peek().type())) {
            return first;
        }

        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (isPrimaryStart(lexer.peek().type())) {
            elements.add(parsePrimary());
        }
        return new ConcatExpr(first.loc(), elements);
    }

    private Expr parsePrimary() {
        Token token = lexer.next();
        switch (token.type()) {
            case PAREN_OPEN: {
                Expr inner = parseExpr();
                consume(TokenType.PAREN_CLOSE, TokenType.PAREN_CLOSE.description());
                return inner;
            }
            case CURLY_OPEN: {
                Expr body = parseExpr();
                consume(TokenType.CURLY_CLOSE, TokenType.CURLY_CLOSE.description());
                return new RepetitionExpr(token.loc(), body, 0, defaultMaxRepetition);
            }
            case BRACKET_OPEN: {
                Expr body = parseExpr();
                consume(TokenType.BRACKET_CLOSE, TokenType.BRACKET_CLOSE.description());
                return new RepetitionExpr(token.loc(), body, 0, 1);
            }
            case SYMBOL:
                return new SymbolExpr(token.loc(), token.text());
            case STRING:
                return parseStringOrRange(token);
            case VALUE_RANGE: {
                int[] bounds = token.text().codePoints().toArray();
                if (bounds.length != 2) {
                    throw new ParseException(token.loc(),
                            "Value range is expected to have exactly 2 boundaries. Got " + bounds.length + " instead.");
                }
                return new RangeExpr(token.loc(), bounds[0], bounds[1]);
            }
            case ASTERISK: {
                int upper = defaultMaxRepetition;
                if (check(TokenType.NUMBER)) {
                    upper = lexer.next().number();
                }
                Expr body = parsePrimary();
                return new RepetitionExpr(token.loc(), body, 0, upper);
            }
            case NUMBER:
                return parseCountedRepetition(token);
            default:
                throw new ParseException(token, "start of an expression");
        }
    }

    /**
     * 字符串字面量后紧跟 "..." 时，构成一个字符范围
     */
    private Expr parseStringOrRange(Token lowerToken) {
        if (!check(TokenType.ELLIPSIS)) {
            return new StringExpr(lowerToken.loc(), lowerToken.text());
        }

        int lowerLength = lowerToken.text().codePointCount(0, lowerToken.text().length());
        if (lowerLength != 1) {
            throw new ParseException(lowerToken.loc(),
                    "The lower boundary of the range is expected to be 1 symbol string. Got " + lowerLength + " instead.");
        }
        lexer.dropPeek(); // 消耗掉 "..."

        Token upperToken = consume(TokenType.STRING, TokenType.STRING.description());
        int upperLength = upperToken.text().codePointCount(0, upperToken.text().length());
        if (upperLength != 1) {
            throw new ParseException(upperToken.loc(),
                    "The upper boundary of the range is expected to be 1 symbol string. Got " + upperLength + " instead.");
        }

        return new RangeExpr(lowerToken.loc(), lowerToken.text().codePointAt(0), upperToken.text().codePointAt(0));
    }

    /**
     * n Primary 表示恰好重复 n 次; n * [m] Primary 表示重复 n 到 m 次
     */
    private Expr parseCountedRepetition(Token countToken) {
        int lower = countToken.number();
        if (!match(TokenType.ASTERISK)) {
            Expr body = parsePrimary();
            return new RepetitionExpr(countToken.loc(), body, lower, lower);
        }

        int upper = defaultMaxRepetition;
        if (check(TokenType.NUMBER)) {
            upper = lexer.next().number();
        }
        Expr body = parsePrimary();
        return new RepetitionExpr(countToken.loc(), body, lower, upper);
    }

    // --- 辅助方法 ---

    private boolean match(TokenType type) {
        if (check(type)) {
            lexer.next();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        Token token = lexer.next();
        if (token.type() != type) {
            throw new ParseException(token, expected);
        }
        return token;
    }

    private boolean check(TokenType type) {
        return lexer.peek().type() == type;
    }
}
