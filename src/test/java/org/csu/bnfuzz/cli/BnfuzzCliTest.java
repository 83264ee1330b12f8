package org.csu.bnfuzz.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口的端到端测试
 */
public class BnfuzzCliTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private BnfuzzCli cli;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        cli = new BnfuzzCli(new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private Path grammar(String... lines) throws IOException {
        Path file = dir.resolve("grammar.bnf");
        Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
        return file;
    }

    private List<String> outLines() {
        String out = outBuffer.toString(StandardCharsets.UTF_8);
        return out.isEmpty() ? List.of() : Arrays.asList(out.split("\\R"));
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testGeneratesRequestedCount() throws IOException {
        System.out.println("--- Running test: generate messages ---");
        Path file = grammar("digit ::= \"0\" | \"1\" | \"2\"");
        int code = cli.run(new String[]{"-file", file.toString(), "-entry", "digit", "-count", "5", "-seed", "11"});
        assertEquals(0, code, err());
        List<String> lines = outLines();
        assertEquals(5, lines.size());
        for (String line : lines) {
            assertTrue(Set.of("0", "1", "2").contains(line));
        }
    }

    @Test
    void testSameSeedSameOutput() throws IOException {
        System.out.println("--- Running test: seeded output ---");
        Path file = grammar("word = 1*8 (\"a\" ... \"z\")");
        String[] args = {"-file=" + file, "-entry=word", "-count=10", "-seed=5"};
        assertEquals(0, cli.run(args));
        List<String> first = outLines();
        outBuffer.reset();
        assertEquals(0, cli.run(args));
        assertEquals(first, outLines());
    }

    @Test
    void testListsRuleNames() throws IOException {
        System.out.println("--- Running test: list rule names ---");
        Path file = grammar("zeta = \"z\"", "alpha = <zeta>", "mid = \"m\"");
        assertEquals(0, cli.run(new String[]{"-file", file.toString(), "-entry", "!"}));
        assertEquals(List.of("alpha", "mid", "zeta"), outLines());
    }

    @Test
    void testDumpPrintsTheRule() throws IOException {
        System.out.println("--- Running test: dump ---");
        Path file = grammar("number = [\"-\"] 1*3 digit", "digit = %x30-39");
        assertEquals(0, cli.run(new String[]{"-file", file.toString(), "-entry", "number", "-dump"}));
        assertEquals(List.of("<number> ::= [\"-\"] 1*3 <digit>"), outLines());
    }

    @Test
    void testMissingRequiredFlags() throws IOException {
        System.out.println("--- Running test: missing flags ---");
        assertEquals(1, cli.run(new String[]{"-entry", "x"}));
        assertTrue(err().contains("ERROR: -file is not provided"));

        errBuffer.reset();
        Path file = grammar("x = \"a\"");
        assertEquals(1, cli.run(new String[]{"-file", file.toString()}));
        assertTrue(err().contains("ERROR: -entry is not provided"));
    }

    @Test
    void testUndefinedEntry() throws IOException {
        System.out.println("--- Running test: undefined entry ---");
        Path file = grammar("x = \"a\"");
        assertEquals(1, cli.run(new String[]{"-file", file.toString(), "-entry", "y"}));
        assertTrue(err().contains("ERROR: Symbol y is not defined"));
    }

    @Test
    void testParseErrorsFailAfterReportingEveryLine() throws IOException {
        System.out.println("--- Running test: parse errors ---");
        Path file = grammar("x ::= \"a\"", "x ::= \"b\"", "y ::= (", "z ::= \"ok\"");
        assertEquals(1, cli.run(new String[]{"-file", file.toString(), "-entry", "z"}));
        String err = err();
        assertTrue(err.contains(file + ":2:1: ERROR: Redefinition of the rule x"));
        assertTrue(err.contains(file + ":1:1: NOTE: The first definition is located here"));
        assertTrue(err.contains(file + ":3:8: ERROR: Expected start of an expression but got end of line"));
        assertTrue(outLines().isEmpty());
    }

    @Test
    void testVerifyReportsUndefinedSymbols() throws IOException {
        System.out.println("--- Running test: -verify ---");
        Path file = grammar("a = <b> | <c>", "b = \"x\"");
        assertEquals(0, cli.run(new String[]{"-file", file.toString(), "-entry", "b"}));

        errBuffer.reset();
        assertEquals(1, cli.run(new String[]{"-file", file.toString(), "-entry", "b", "-verify"}));
        assertTrue(err().contains(file + ":1:11: ERROR: Symbol <c> is not defined"));
    }

    @Test
    void testUnusedReportsUnreachableRules() throws IOException {
        System.out.println("--- Running test: -unused ---");
        Path file = grammar("a ::= <b>", "b ::= <a> | \"x\"", "c ::= \"z\"");
        assertEquals(1, cli.run(new String[]{"-file", file.toString(), "-entry", "a", "-unused"}));
        assertTrue(err().contains(file + ":3:1: ERROR: Symbol <c> is unused"));

        errBuffer.reset();
        outBuffer.reset();
        assertEquals(0, cli.run(new String[]{"-file", file.toString(), "-entry", "c", "-unused=false"}));
        assertEquals(List.of("z"), outLines());
    }

    @Test
    void testGenerationErrorFails() throws IOException {
        System.out.println("--- Running test: generation error ---");
        Path file = grammar("a = \"z\" ... \"a\"");
        assertEquals(1, cli.run(new String[]{"-file", file.toString(), "-entry", "a"}));
        assertTrue(err().contains("Lower bound of the range"));
    }

    @Test
    void testUnreadableFile() {
        System.out.println("--- Running test: missing file ---");
        Path missing = dir.resolve("missing.bnf");
        assertEquals(1, cli.run(new String[]{"-file", missing.toString(), "-entry", "x"}));
        assertTrue(err().contains("ERROR: could not read file"));
    }

    @Test
    void testHelp() {
        assertEquals(0, cli.run(new String[]{"-help"}));
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).startsWith("Usage: bnfuzz"));
    }
}
