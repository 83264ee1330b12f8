package org.csu.bnfuzz.compiler.lexer;

import org.csu.bnfuzz.common.exception.ParseException;
import org.csu.bnfuzz.common.model.Loc;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 每次只处理语法文件中的一行，按需切分出 Token，并提供单个 Token 的向前看缓冲。
 * 所有词法错误都以 {@link ParseException} 抛出。
 */
public class Lexer {

    /**
     * 固定字面量表，按“最具体者优先”的顺序匹配：
     * "::=" 与 "=/" 必须排在 "=" 之前。
     */
    private static final List<Literal> LITERAL_TOKENS = List.of(
            new Literal("::=", TokenType.DEFINITION),
            new Literal("=/", TokenType.INCREMENTAL_ALTERNATIVE),
            new Literal("=", TokenType.DEFINITION),
            new Literal("|", TokenType.ALTERNATION),
            new Literal("/", TokenType.ALTERNATION),
            new Literal("[", TokenType.BRACKET_OPEN),
            new Literal("]", TokenType.BRACKET_CLOSE),
            new Literal("{", TokenType.CURLY_OPEN),
            new Literal("}", TokenType.CURLY_CLOSE),
            new Literal("(", TokenType.PAREN_OPEN),
            new Literal(")", TokenType.PAREN_CLOSE),
            new Literal("...", TokenType.ELLIPSIS),
            new Literal("*", TokenType.ASTERISK),
            // '-' 同时也是符号名的首字符，符号规则优先，这一项仅为兼容旧方言保留
            new Literal("-", TokenType.DASH)
    );

    private record Literal(String text, TokenType type) {
    }

    private final int[] content;
    private final String filePath;
    private final int row;
    private int column = 0;

    private Token peekBuffer;

    public Lexer(String line, String filePath, int row) {
        this.content = line.codePoints().toArray();
        this.filePath = filePath;
        this.row = row;
    }

    /**
     * 消耗并返回下一个 Token
     */
    public Token next() {
        if (peekBuffer != null) {
            Token token = peekBuffer;
            peekBuffer = null;
            return token;
        }
        return chopToken();
    }

    /**
     * 返回下一个 Token 但不消耗它。结果缓存在单个槽位中。
     */
    public Token peek() {
        if (peekBuffer == null) {
            peekBuffer = chopToken();
        }
        return peekBuffer;
    }

    /**
     * 丢弃已缓存的向前看 Token。读取位置已经越过了它，因此效果等同于消耗。
     */
    public void dropPeek() {
        peekBuffer = null;
    }

    /**
     * 切分整行，返回的列表以 EOL 结尾。主要用于调试和测试。
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.type() != TokenType.EOL);
        return tokens;
    }

    private Token chopToken() {
        skipWhitespace();

        // 注释一直持续到行尾
        if (startsWith("//") || startsWith(";")) {
            column = content.length;
        }

        Loc start = loc();
        if (isAtEnd()) {
            return Token.of(TokenType.EOL, "", start);
        }

        int current = content[column];

        if (isDigit(current)) {
            return readNumber();
        }
        if (isSymbolStart(current)) {
            return readBareSymbol();
        }
        if (current == '<') {
            return readAngleSymbol();
        }
        if (current == '"' || current == '\'') {
            return readString();
        }
        if (current == '%' && peekAt(1) == 'x') {
            return readValueRange();
        }

        for (Literal literal : LITERAL_TOKENS) {
            if (startsWith(literal.text())) {
                column += literal.text().length();
                return Token.of(literal.type(), literal.text(), start);
            }
        }

        throw new ParseException(start, "Invalid token");
    }

    private Token readNumber() {
        Loc start = loc();
        int begin = column;
        while (!isAtEnd() && isDigit(content[column])) {
            column++;
        }
        String digits = substring(begin, column);
        try {
            return new Token(TokenType.NUMBER, digits, digits, Integer.parseInt(digits), start);
        } catch (NumberFormatException e) {
            throw new ParseException(start, "Number " + digits + " is too big");
        }
    }

    private Token readBareSymbol() {
        Loc start = loc();
        int begin = column;
        while (!isAtEnd() && isSymbolChar(content[column])) {
            column++;
        }
        String name = substring(begin, column);
        return new Token(TokenType.SYMBOL, name, name, 0, start);
    }

    private Token readAngleSymbol() {
        Loc start = loc();
        int begin = column;
        column++; // 跳过 '<'
        int nameBegin = column;
        while (!isAtEnd() && content[column] != '>') {
            int ch = content[column];
            if (!isSymbolChar(ch)) {
                throw new ParseException(loc(), "Unexpected character in symbol name " + quoteChar(ch));
            }
            column++;
        }
        if (isAtEnd()) {
            throw new ParseException(loc(), "Expected '>' at the end of the symbol name");
        }
        String name = substring(nameBegin, column);
        if (name.isEmpty()) {
            throw new ParseException(start, "Symbol name is empty");
        }
        column++; // 跳过 '>'
        return new Token(TokenType.SYMBOL, substring(begin, column), name, 0, start);
    }

    private Token readString() {
        Loc start = loc();
        int begin = column;
        int quote = content[column];
        column++; // 跳过起始引号

        StringBuilder literal = new StringBuilder();
        while (!isAtEnd() && content[column] != quote) {
            int ch = content[column];
            if (ch == '\\') {
                literal.appendCodePoint(readEscape(quote));
            } else {
                literal.appendCodePoint(ch);
                column++;
            }
        }

        if (isAtEnd()) {
            throw new ParseException(start, "Expected " + quoteChar(quote) + " at the end of this string literal");
        }
        column++; // 跳过结束引号
        return new Token(TokenType.STRING, substring(begin, column), literal.toString(), 0, start);
    }

    /**
     * 读取一个以反斜杠开头的转义序列，返回其代表的码点
     */
    private int readEscape(int quote) {
        column++; // 跳过 '\'
        if (isAtEnd()) {
            throw new ParseException(loc(), "Unfinished escape sequence");
        }
        int ch = content[column];
        switch (ch) {
            case 'n':
                column++;
                return '\n';
            case 'r':
                column++;
                return '\r';
            case '\\':
                column++;
                return '\\';
            case '0':
                column++;
                return 0;
            case 'x':
                column++;
                int high = readHexDigit("Unfinished escape sequence");
                int low = readHexDigit("Unfinished escape sequence");
                return high * 16 + low;
            default:
                if (ch == quote) {
                    column++;
                    return quote;
                }
                throw new ParseException(loc(), "Unknown escape sequence starting with " + quoteChar(ch));
        }
    }

    private Token readValueRange() {
        Loc start = loc();
        int begin = column;
        column += 2; // 跳过 "%x"
        int lower = readHexByte();
        if (isAtEnd() || content[column] != '-') {
            throw new ParseException(loc(), "Expected '-' between the boundaries of the value range");
        }
        column++;
        int upper = readHexByte();
        String bounds = new String(new int[]{lower, upper}, 0, 2);
        return new Token(TokenType.VALUE_RANGE, substring(begin, column), bounds, 0, start);
    }

    private int readHexByte() {
        int high = readHexDigit("Unfinished value range");
        int low = readHexDigit("Unfinished value range");
        return high * 16 + low;
    }

    private int readHexDigit(String endOfLineMessage) {
        if (isAtEnd()) {
            throw new ParseException(loc(), endOfLineMessage);
        }
        int digit = Character.digit(content[column], 16);
        if (digit < 0) {
            throw new ParseException(loc(), "Expected a hex digit but got " + quoteChar(content[column]));
        }
        column++;
        return digit;
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (!isAtEnd() && isSpace(content[column])) {
            column++;
        }
    }

    private boolean startsWith(String prefix) {
        int[] expected = prefix.codePoints().toArray();
        if (column + expected.length > content.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (content[column + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }

    private int peekAt(int offset) {
        int index = column + offset;
        return index < content.length ? content[index] : -1;
    }

    private boolean isAtEnd() {
        return column >= content.length;
    }

    private Loc loc() {
        return new Loc(filePath, row, column);
    }

    private String substring(int begin, int end) {
        return new String(content, begin, end - begin);
    }

    private static String quoteChar(int ch) {
        return "'" + new String(Character.toChars(ch)) + "'";
    }

    // 包括 U+00A0、U+0085 等 isWhitespace 不认的空白
    private static boolean isSpace(int ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == 0x85;
    }

    private static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isSymbolStart(int ch) {
        return Character.isLetter(ch) || ch == '-' || ch == '_';
    }

    private static boolean isSymbolChar(int ch) {
        return Character.isLetterOrDigit(ch) || ch == '-' || ch == '_';
    }
}
