package software.amazon.nfa;

import software.amazon.nfa.input.PatternException;
import software.amazon.nfa.input.PatternParser;

import java.util.Objects;

/**
 * Compiles patterns, given as text or as an already parsed tree, into automata. Compilation is atomic: either a
 * complete automaton is returned or a {@link PatternException} is thrown and nothing is left behind.
 */
public final class NfaCompiler {

    private NfaCompiler() { }

    /**
     * Verify the syntax of a pattern.
     *
     * @param pattern pattern text
     * @return null if the pattern is valid, otherwise an error message
     */
    public static String check(final String pattern) {
        return check(pattern, Configuration.defaults());
    }

    public static String check(final String pattern, final Configuration configuration) {
        try {
            compile(pattern, configuration);
            return null;
        } catch (PatternException e) {
            return e.getLocalizedMessage();
        }
    }

    public static Nfa compile(final String pattern) {
        return compile(pattern, Configuration.defaults());
    }

    /**
     * @param pattern pattern text, see {@link PatternParser} for the syntax
     * @param configuration compile options
     * @return the automaton accepting exactly the inputs the pattern describes
     * @throws PatternException if the text is not a valid pattern or needs too many states
     */
    public static Nfa compile(final String pattern, final Configuration configuration) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(configuration, "configuration");
        return compile(new PatternParser(configuration).parse(pattern), configuration);
    }

    public static Nfa compile(final PatternNode tree) {
        return compile(tree, Configuration.defaults());
    }

    /**
     * @param tree pattern tree, see {@link Patterns}
     * @param configuration compile options
     * @return the automaton accepting exactly the inputs the tree describes
     * @throws PatternException if the automaton would need more states than the configuration allows
     */
    public static Nfa compile(final PatternNode tree, final Configuration configuration) {
        Objects.requireNonNull(tree, "tree");
        final long states = ThompsonConstructor.countStates(tree);
        if (states > configuration.getMaximumStates()) {
            throw new PatternException("Pattern needs " + states + " states, more than the maximum of "
                    + configuration.getMaximumStates(), 0);
        }
        return new ThompsonConstructor().construct(tree);
    }
}
