package org.csu.bnfuzz.engine;

import org.csu.bnfuzz.common.exception.GenerationException;
import org.csu.bnfuzz.compiler.parser.ast.RepetitionExpr;
import org.csu.bnfuzz.compiler.semantic.Grammar;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 随机生成器的测试。所有用例都使用固定种子。
 */
public class MessageGeneratorTest {

    private static final int ITERATIONS = 500;

    private static Grammar load(String... lines) {
        GrammarLoader.LoadResult result = new GrammarLoader().loadLines("test.bnf", List.of(lines));
        assertFalse(result.hasErrors(), () -> "Unexpected diagnostics: " + result.diagnostics());
        return result.grammar();
    }

    private static MessageGenerator generator(Grammar grammar) {
        return new MessageGenerator(grammar, new Random(42));
    }

    @Test
    void testAlternationPicksOneOfTheVariants() {
        System.out.println("--- Running test: digit alternation ---");
        MessageGenerator generator = generator(load("digit ::= \"0\" | \"1\" | \"2\""));
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < ITERATIONS; i++) {
            String message = generator.generate("digit");
            assertTrue(Set.of("0", "1", "2").contains(message), "Unexpected message: " + message);
            seen.add(message);
        }
        assertEquals(Set.of("0", "1", "2"), seen);
    }

    @Test
    void testValueRangeStaysWithinBounds() {
        System.out.println("--- Running test: OCTAL value range ---");
        MessageGenerator generator = generator(load("OCTAL ::= %x30-37"));
        for (int i = 0; i < ITERATIONS; i++) {
            String message = generator.generate("OCTAL");
            assertEquals(1, message.length());
            char ch = message.charAt(0);
            assertTrue(ch >= '0' && ch <= '7', "Out of range: " + ch);
        }
    }

    @Test
    void testRepetitionCountStaysWithinBounds() {
        System.out.println("--- Running test: repetition bounds ---");
        MessageGenerator generator = generator(load("r = 2*4 \"ab\""));
        Set<Integer> counts = new HashSet<>();
        for (int i = 0; i < ITERATIONS; i++) {
            String message = generator.generate("r");
            assertEquals(0, message.length() % 2);
            assertEquals("ab".repeat(message.length() / 2), message);
            int count = message.length() / 2;
            assertTrue(count >= 2 && count <= 4, "Unexpected count: " + count);
            counts.add(count);
        }
        assertEquals(Set.of(2, 3, 4), counts);
    }

    @Test
    void testExactAndEmptyRepetition() {
        System.out.println("--- Running test: exact repetition ---");
        MessageGenerator generator = generator(load(
                "three = 3 \"x\"",
                "none = 0 \"x\"",
                "maybe = [\"y\"]"));
        assertEquals("xxx", generator.generate("three"));
        assertEquals("", generator.generate("none"));
        for (int i = 0; i < ITERATIONS; i++) {
            String message = generator.generate("maybe");
            assertTrue(message.isEmpty() || message.equals("y"));
        }
    }

    @Test
    void testSymbolsAndConcatenation() {
        System.out.println("--- Running test: nested symbols ---");
        MessageGenerator generator = generator(load(
                "greeting = (\"hello\" | \"hi\") \", \" <name> \"!\"",
                "name = \"bob\" | \"alice\""));
        Set<String> expected = Set.of("hello, bob!", "hello, alice!", "hi, bob!", "hi, alice!");
        for (int i = 0; i < ITERATIONS; i++) {
            assertTrue(expected.contains(generator.generate("greeting")));
        }
    }

    @Test
    void testSameSeedProducesSameMessages() {
        System.out.println("--- Running test: deterministic generation ---");
        Grammar grammar = load(
                "id = letter *7(letter | digit)",
                "letter = \"a\" ... \"z\"",
                "digit = %x30-39");
        MessageGenerator first = new MessageGenerator(grammar, new Random(7));
        MessageGenerator second = new MessageGenerator(grammar, new Random(7));
        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            a.add(first.generate("id"));
            b.add(second.generate("id"));
        }
        assertEquals(a, b);
        for (String id : a) {
            assertTrue(id.matches("[a-z][a-z0-9]{0,7}"), "Unexpected id: " + id);
        }
    }

    @Test
    void testInvertedBoundsAreErrors() {
        System.out.println("--- Running test: inverted bounds ---");
        MessageGenerator generator = generator(load(
                "range = \"z\" ... \"a\"",
                "rep = 5*2 \"a\""));
        GenerationException range = assertThrows(GenerationException.class, () -> generator.generate("range"));
        assertTrue(range.getMessage().contains("Lower bound of the range"));
        assertEquals(0, range.getDiagnostic().loc().row());

        GenerationException rep = assertThrows(GenerationException.class, () -> generator.generate("rep"));
        assertTrue(rep.getMessage().contains("Lower bound of the repetition (5) is greater than the upper bound (2)"));
    }

    @Test
    void testUndefinedSymbolIsAnError() {
        System.out.println("--- Running test: undefined symbol ---");
        MessageGenerator generator = generator(load("a = \"x\" <nope>"));
        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate("a"));
        assertTrue(e.getMessage().contains("Symbol <nope> is not defined"));
        assertEquals(8, e.getDiagnostic().loc().column());

        GenerationException entry = assertThrows(GenerationException.class, () -> generator.generate("missing"));
        assertNull(entry.getDiagnostic().loc());
        assertEquals("ERROR: Symbol <missing> is not defined", entry.getMessage());
    }

    @Test
    void testWidestRepetitionBoundDoesNotOverflow() {
        System.out.println("--- Running test: testWidestRepetitionBoundDoesNotOverflow ---");
        Grammar grammar = load("r = *2147483647 \"a\"");
        RepetitionExpr repetition = assertInstanceOf(RepetitionExpr.class, grammar.getRule("r").body());
        assertEquals(Integer.MAX_VALUE, repetition.upper());

        // 记录抽取区间并总是返回下界，避免真的展开 2^31 次
        long[] drawn = new long[2];
        Random recording = new Random(1) {
            @Override
            public long nextLong(long origin, long bound) {
                drawn[0] = origin;
                drawn[1] = bound;
                return origin;
            }
        };
        MessageGenerator generator = new MessageGenerator(grammar, recording);
        assertEquals("", generator.generate("r"));
        assertEquals(0L, drawn[0]);
        assertEquals(1L << 31, drawn[1]);
    }
}
