package org.csu.bnfuzz.cli;

import org.csu.bnfuzz.common.exception.GenerationException;
import org.csu.bnfuzz.common.model.Diagnostic;
import org.csu.bnfuzz.compiler.parser.ExprPrinter;
import org.csu.bnfuzz.compiler.parser.ast.Rule;
import org.csu.bnfuzz.compiler.semantic.Grammar;
import org.csu.bnfuzz.compiler.semantic.GrammarValidator;
import org.csu.bnfuzz.engine.GrammarLoader;
import org.csu.bnfuzz.engine.MessageGenerator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * @author hidyouth
 * @description: 命令行入口
 *
 * 读取语法文件，按需执行静态检查，然后从入口规则生成随机消息。
 * 成功返回 0，任何错误返回 1。
 */
public class BnfuzzCli {

    private final PrintStream out;
    private final PrintStream err;

    public BnfuzzCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new BnfuzzCli(System.out, System.err).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return 1;
        }

        if (options.help()) {
            out.println(CliOptions.USAGE);
            return 0;
        }
        if (options.file() == null || options.file().isEmpty()) {
            err.println("ERROR: -file is not provided");
            err.println(CliOptions.USAGE);
            return 1;
        }
        if (options.entry() == null || options.entry().isEmpty()) {
            err.println("ERROR: -entry is not provided");
            err.println(CliOptions.USAGE);
            return 1;
        }

        GrammarLoader.LoadResult result;
        try {
            result = new GrammarLoader(options.maxRepetition()).load(Path.of(options.file()));
        } catch (IOException e) {
            err.println("ERROR: could not read file " + options.file() + ": " + e.getMessage());
            return 1;
        }
        result.diagnostics().forEach(err::println);
        if (result.hasErrors()) {
            return 1;
        }
        Grammar grammar = result.grammar();

        GrammarValidator validator = new GrammarValidator();
        if (options.verify()) {
            List<Diagnostic> undefined = validator.validateDefined(grammar);
            undefined.forEach(err::println);
            if (!undefined.isEmpty()) {
                return 1;
            }
        }

        if (CliOptions.LIST_ENTRY.equals(options.entry())) {
            List<String> names = new ArrayList<>(grammar.getRuleNames());
            names.sort(null);
            names.forEach(out::println);
            return 0;
        }

        Rule entry = grammar.getRule(options.entry());
        if (entry == null) {
            err.println("ERROR: Symbol " + options.entry() + " is not defined");
            return 1;
        }

        if (options.unused()) {
            List<Diagnostic> unused = validator.validateReachable(grammar, options.entry());
            unused.forEach(err::println);
            if (!unused.isEmpty()) {
                return 1;
            }
        }

        if (options.dump()) {
            out.println(new ExprPrinter(options.maxRepetition()).print(entry));
            return 0;
        }

        Random random = options.seed() != null ? new Random(options.seed()) : new Random(System.nanoTime());
        MessageGenerator generator = new MessageGenerator(grammar, random);
        for (int i = 0; i < options.count(); i++) {
            try {
                out.println(generator.generate(options.entry()));
            } catch (GenerationException e) {
                err.println(e.getDiagnostic());
                return 1;
            }
        }
        return 0;
    }
}
