package software.amazon.nfa;

import software.amazon.nfa.input.Condition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Factory for pattern trees. This is useful if you already know the structure of the pattern and would like to build
 * it directly instead of writing pattern text and having it parsed. Once you have a tree, compile it with
 * {@link NfaCompiler#compile(PatternNode)}.
 */
public final class Patterns {

    private Patterns() { }

    public static PatternNode symbol(final Condition condition) {
        return new SymbolNode(condition);
    }

    public static PatternNode symbol(final int codePoint) {
        return new SymbolNode(Condition.symbol(codePoint));
    }

    public static PatternNode range(final int from, final int to) {
        return new SymbolNode(Condition.range(from, to));
    }

    public static PatternNode special(final char name) {
        return new SymbolNode(Condition.special(name));
    }

    public static PatternNode epsilon() {
        return new SymbolNode(Condition.epsilon());
    }

    /**
     * @param value literal text; no character in it has a special meaning
     * @return the concatenation of one symbol per code point of value
     */
    public static PatternNode literal(final String value) {
        final List<PatternNode> symbols = new ArrayList<>(value.length());
        value.codePoints().forEach(codePoint -> symbols.add(symbol(codePoint)));
        if (symbols.size() == 1) {
            return symbols.get(0);
        }
        return new CompositeNode(NodeType.CONCATENATION, symbols);
    }

    public static PatternNode concatenation(final PatternNode... operands) {
        return concatenation(Arrays.asList(operands));
    }

    public static PatternNode concatenation(final List<PatternNode> operands) {
        return new CompositeNode(NodeType.CONCATENATION, operands);
    }

    public static PatternNode alternation(final PatternNode... branches) {
        return alternation(Arrays.asList(branches));
    }

    public static PatternNode alternation(final List<PatternNode> branches) {
        return new CompositeNode(NodeType.ALTERNATION, branches);
    }

    public static PatternNode star(final PatternNode operand) {
        return new RepetitionNode(NodeType.STAR, operand);
    }

    public static PatternNode plus(final PatternNode operand) {
        return new RepetitionNode(NodeType.PLUS, operand);
    }

    public static PatternNode optional(final PatternNode operand) {
        return new RepetitionNode(NodeType.OPTIONAL, operand);
    }

    /**
     * @return the pattern that matches only the empty input
     */
    public static PatternNode empty() {
        return new CompositeNode(NodeType.CONCATENATION, Collections.emptyList());
    }

    /**
     * @return the pattern that matches nothing, not even the empty input
     */
    public static PatternNode nothing() {
        return new CompositeNode(NodeType.ALTERNATION, Collections.emptyList());
    }
}
