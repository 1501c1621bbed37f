package software.amazon.nfa.input;

import org.junit.Test;
import software.amazon.nfa.Configuration;
import software.amazon.nfa.Nfa;
import software.amazon.nfa.NfaCompiler;
import software.amazon.nfa.Simulator;
import software.amazon.nfa.Transition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NfaDescriptionParserTest {

    private static final String DESCRIPTION = "type: nfa\n" +
            "states: 3\n" +
            "final: 2\n" +
            "rules:\n" +
            "0->1 a\n" +
            "1->1 \\e\n" +
            "1->2 0-9 \\d\n" +
            "input: a5\n";

    @Test
    public void testParse() {
        Nfa nfa = NfaDescriptionParser.parse(DESCRIPTION);
        assertEquals(3, nfa.getStateCount());
        assertEquals(0, nfa.getStartState());
        assertTrue(nfa.isAccepting(2));
        assertFalse(nfa.isAccepting(0));
        assertEquals(4, nfa.getTransitionCount());

        List<Transition> fromOne = nfa.getTransitions(1);
        assertEquals(3, fromOne.size());
        assertTrue(fromOne.get(0).isEpsilon());
        assertEquals(Condition.range('0', '9'), fromOne.get(1).getCondition());
        assertEquals(Condition.special('d'), fromOne.get(2).getCondition());
        assertEquals(2, fromOne.get(2).getTo());
    }

    @Test
    public void testParsedAutomatonRuns() {
        Simulator simulator = new Simulator(NfaDescriptionParser.parse(DESCRIPTION));
        assertTrue(simulator.matches("a5"));
        assertFalse(simulator.matches("a"));
        assertFalse(simulator.matches("5"));
        assertEquals("0 a 1 5 2", simulator.exec("a5").toString());
    }

    @Test
    public void testParseSpaceCondition() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 2\nfinal: 1\nrules:\n0->1   x\n");
        List<Transition> transitions = nfa.getTransitions(0);
        assertEquals(2, transitions.size());
        assertEquals(Condition.symbol(' '), transitions.get(0).getCondition());
        assertEquals(Condition.symbol('x'), transitions.get(1).getCondition());
    }

    @Test
    public void testParseTrailingSpaceCondition() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 2\nfinal: 1\nrules:\n0->1  \n");
        assertTrue(new Simulator(nfa).matches(" "));
    }

    @Test
    public void testParseAnyCharacterSpecial() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 2\nfinal: 1\nrules:\n0->1 \\.\n");
        Simulator simulator = new Simulator(nfa);
        assertTrue(simulator.matches("x"));
        assertFalse(simulator.matches("\n"));
    }

    @Test
    public void testParseWithStartState() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 2\nstart: 1\nfinal: 0\nrules:\n1->0 b\n");
        assertEquals(1, nfa.getStartState());
        assertTrue(new Simulator(nfa).matches("b"));
    }

    @Test
    public void testParseWithoutFinalStates() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 1\nfinal:\nrules:\n0->0 a\n");
        assertTrue(nfa.getAcceptingStates().isEmpty());
        assertFalse(new Simulator(nfa).matches(""));
    }

    @Test
    public void testRoundTripThroughToString() {
        Nfa nfa = NfaDescriptionParser.parse(DESCRIPTION);
        Nfa reparsed = NfaDescriptionParser.parse(nfa.toString());
        assertEquals(nfa.toString(), reparsed.toString());
    }

    @Test
    public void testCompiledAutomataRoundTrip() {
        List<String> patterns = Arrays.asList("[ab]", "[^\\d-]", "a\\nb", "\\t\\r\\f\\\\", "[ -~]+",
                "[\\]\\[^-]", "\\s\\S.\\W", "\013|x", "( |-)*");
        for (String pattern : patterns) {
            assertRoundTrip(NfaCompiler.compile(pattern));
        }
        Configuration dotAll = new Configuration.Builder().withDotMatchesLineTerminators(true).build();
        assertRoundTrip(NfaCompiler.compile(".", dotAll));
    }

    @Test
    public void testParseClassesAndEscapes() {
        Nfa nfa = NfaDescriptionParser.parse("type: nfa\nstates: 3\nfinal: 2\nrules:\n" +
                "0->1 [^\\u0020\\n] \\t\n" +
                "1->2 \\u0041-\\u005a [\\d\\-]\n");
        List<Transition> fromZero = nfa.getTransitions(0);
        assertEquals(Condition.characterClass(true, Arrays.asList(Condition.symbol(' '), Condition.symbol('\n'))),
                fromZero.get(0).getCondition());
        assertEquals(Condition.symbol('\t'), fromZero.get(1).getCondition());
        List<Transition> fromOne = nfa.getTransitions(1);
        assertEquals(Condition.range('A', 'Z'), fromOne.get(0).getCondition());
        assertEquals(Condition.characterClass(false, Arrays.asList(Condition.special('d'), Condition.symbol('-'))),
                fromOne.get(1).getCondition());

        Simulator simulator = new Simulator(nfa);
        assertTrue(simulator.matches("xQ"));
        assertTrue(simulator.matches("\t-"));
        assertTrue(simulator.matches("\t7"));
        assertFalse(simulator.matches(" Q"));
        assertFalse(simulator.matches("xq"));
    }

    @Test
    public void testParseWithBadClassesAndEscapes() {
        String header = "type: nfa\nstates: 2\nfinal: 1\nrules:\n";
        assertError(header + "0->1 [ab\n", "Invalid condition [ab at pos 5", 5);
        assertError(header + "0->1 []\n", "Invalid condition [] at pos 5", 5);
        assertError(header + "0->1 [a]b\n", "Invalid condition [a]b at pos 5", 5);
        assertError(header + "0->1 [\\e]\n", "Invalid condition [\\e] at pos 5", 5);
        assertError(header + "0->1 \\u12\n", "Invalid condition \\u12 at pos 5", 5);
        assertError(header + "0->1 \\u00g1\n", "Invalid condition \\u00g1 at pos 5", 5);
        assertError(header + "0->1 a-\n", "Invalid condition a- at pos 5", 5);
    }

    @Test
    public void testParseWithTooManyStates() {
        assertError("type: nfa\nstates: 2000000000\n",
                "Automaton has 2000000000 states, more than the maximum of 100000 at pos 2", 2);
        Configuration configuration = new Configuration.Builder().withMaximumStates(3).build();
        assertEquals(3, NfaDescriptionParser.parse("type: nfa\nstates: 3\nfinal:\n", configuration)
                .getStateCount());
        try {
            NfaDescriptionParser.parse("type: nfa\nstates: 4\n", configuration);
            fail("Expected PatternException");
        } catch (PatternException e) {
            assertEquals("Automaton has 4 states, more than the maximum of 3 at pos 2", e.getMessage());
        }
    }

    @Test
    public void testParseFixture() throws IOException {
        Nfa nfa = NfaDescriptionParser.parse(readResource("/descriptions/epsilon-cycle.nfa"));
        Simulator simulator = new Simulator(nfa);
        assertTrue(simulator.matches(""));
        assertTrue(simulator.matches("ab"));
        assertTrue(simulator.matches("abba"));
        assertFalse(simulator.matches("abc"));
        assertNull(simulator.exec("c"));
    }

    @Test
    public void testParseWithWrongType() {
        assertError("type: dfa\nstates: 1\n", "Description type is not nfa at pos 2", 2);
        assertError("states: 1\n", "Description type is not nfa at pos 1", 1);
    }

    @Test
    public void testParseWithMisplacedStates() {
        assertError("type: nfa\nfinal: 0\nstates: 1\n", "states: must come first at pos 2", 2);
        assertError("type: nfa\nstates: 1\nstates: 2\n", "Duplicate states: at pos 3", 3);
        assertError("type: nfa\n", "Missing states: at pos 2", 2);
    }

    @Test
    public void testParseWithBadNumbers() {
        assertError("type: nfa\nstates: x\n", "Invalid state number 'x' at pos 2", 2);
        assertError("type: nfa\nstates: 2\nfinal: 5\n", "Unknown final state 5 at pos 3", 3);
        assertError("type: nfa\nstates: 2\nstart: 7\nfinal: 1\n", "Unknown start state 7 at pos 5", 5);
    }

    @Test
    public void testParseWithBadRules() {
        String header = "type: nfa\nstates: 2\nfinal: 1\nrules:\n";
        assertError(header + "0-1 a\n", "Invalid rule at pos 5", 5);
        assertError(header + "0->1 abc\n", "Invalid condition abc at pos 5", 5);
        assertError(header + "0->1 \\q\n", "Unknown special character \\q at pos 5", 5);
        assertError(header + "0->1 z-a\n", "Invalid range z-a at pos 5", 5);
        assertError(header + "0->3 a\n", "Unknown state in rule 0->3 at pos 5", 5);
        assertError(header + "0->1 \n0->1 a\n", "Rule without conditions at pos 5", 5);
    }

    @Test
    public void testParseWithUnexpectedLine() {
        assertError("type: nfa\nstates: 1\nhello\n", "Unexpected line at pos 3", 3);
    }

    private static final List<String> INPUTS = Arrays.asList("", "a", "b", "c", "a\nb", "\t\r\f\\", "x", "\013",
            "~", " ", "-", "]", "[", "^", "5", "\n", "😀", " - ", "a b", "\\");

    private static void assertRoundTrip(Nfa nfa) {
        String description = nfa.toString();
        Nfa reparsed = NfaDescriptionParser.parse(description);
        assertEquals(description, reparsed.toString());
        Simulator original = new Simulator(nfa);
        Simulator copy = new Simulator(reparsed);
        for (String input : INPUTS) {
            assertEquals(description + " on " + input, original.matches(input), copy.matches(input));
        }
    }

    private static void assertError(String description, String message, int line) {
        try {
            Nfa nfa = NfaDescriptionParser.parse(description);
            fail("Expected PatternException, got " + nfa);
        } catch (PatternException e) {
            assertEquals(message, e.getMessage());
            assertEquals(line, e.getPosition());
        }
    }

    private static String readResource(String name) throws IOException {
        try (InputStream in = NfaDescriptionParserTest.class.getResourceAsStream(name);
             Scanner scanner = new Scanner(in, StandardCharsets.UTF_8.name())) {
            return scanner.useDelimiter("\\A").next();
        }
    }
}
