package org.csu.bnfuzz.engine;

import org.csu.bnfuzz.common.exception.DiagnosticException;
import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.compiler.lexer.Lexer;
import org.csu.bnfuzz.compiler.lexer.TokenType;
import org.csu.bnfuzz.compiler.parser.Parser;
import org.csu.bnfuzz.compiler.parser.ast.RuleDefinition;
import org.csu.bnfuzz.compiler.semantic.Grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 语法文件加载器
 *
 * 逐行词法/语法分析并累积到规则表中。某一行出错时记录诊断信息并继续处理下一行，
 * 全部行处理完之后由调用方根据 {@link LoadResult#hasErrors()} 决定是否失败。
 */
public class GrammarLoader {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    private final int defaultMaxRepetition;

    public GrammarLoader() {
        this(Parser.DEFAULT_MAX_REPETITION);
    }

    public GrammarLoader(int defaultMaxRepetition) {
        this.defaultMaxRepetition = defaultMaxRepetition;
    }

    public LoadResult load(Path file) throws IOException {
        // 非法的 UTF-8 字节解码为 U+FFFD，不让整个文件因此失败
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return loadLines(file.toString(), Arrays.asList(LINE_BREAK.split(content, -1)));
    }

    public LoadResult loadLines(String filePath, List<String> lines) {
        Grammar grammar = new Grammar();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (int row = 0; row < lines.size(); row++) {
            Lexer lexer = new Lexer(lines.get(row), filePath, row);
            try {
                // 空行或纯注释行
                if (lexer.peek().type() == TokenType.EOL) {
                    continue;
                }
                Parser parser = new Parser(lexer, defaultMaxRepetition);
                RuleDefinition definition = parser.parseRule();
                parser.expectEndOfLine();

                if (definition.isIncremental()) {
                    grammar.extend(definition.rule());
                } else {
                    grammar.define(definition.rule());
                }
            } catch (DiagnosticException e) {
                diagnostics.add(e.getDiagnostic());
            }
        }

        return new LoadResult(grammar, diagnostics);
    }

    public record LoadResult(Grammar grammar, List<Diagnostic> diagnostics) {

        public LoadResult {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean hasErrors() {
            return !diagnostics.isEmpty();
        }
    }
}
