package software.amazon.nfa;

/**
 * Configuration for an NfaCompiler.
 */
public class Configuration {

    public static final int DEFAULT_MAXIMUM_STATES = 100_000;
    public static final int DEFAULT_MAXIMUM_NESTING_DEPTH = 1_000;

    /**
     * By default "." accepts any code point except the line terminators \n and \r. Setting this flag to true makes
     * "." accept every code point.
     */
    private final boolean dotMatchesLineTerminators;

    /**
     * Compilation fails for patterns whose automaton would need more states than this. The state count is computed
     * from the pattern tree before any state is created.
     */
    private final int maximumStates;

    /**
     * Parsing fails for pattern text whose groups are nested deeper than this.
     */
    private final int maximumNestingDepth;

    private Configuration(boolean dotMatchesLineTerminators, int maximumStates, int maximumNestingDepth) {
        this.dotMatchesLineTerminators = dotMatchesLineTerminators;
        this.maximumStates = maximumStates;
        this.maximumNestingDepth = maximumNestingDepth;
    }

    public boolean isDotMatchesLineTerminators() {
        return dotMatchesLineTerminators;
    }

    public int getMaximumStates() {
        return maximumStates;
    }

    public int getMaximumNestingDepth() {
        return maximumNestingDepth;
    }

    public static Configuration defaults() {
        return new Builder().build();
    }

    public static class Builder {

        private boolean dotMatchesLineTerminators = false;
        private int maximumStates = DEFAULT_MAXIMUM_STATES;
        private int maximumNestingDepth = DEFAULT_MAXIMUM_NESTING_DEPTH;

        public Builder withDotMatchesLineTerminators(boolean dotMatchesLineTerminators) {
            this.dotMatchesLineTerminators = dotMatchesLineTerminators;
            return this;
        }

        public Builder withMaximumStates(int maximumStates) {
            if (maximumStates < 1) {
                throw new IllegalArgumentException("Maximum states must be positive, got " + maximumStates);
            }
            this.maximumStates = maximumStates;
            return this;
        }

        public Builder withMaximumNestingDepth(int maximumNestingDepth) {
            if (maximumNestingDepth < 1) {
                throw new IllegalArgumentException("Maximum nesting depth must be positive, got "
                        + maximumNestingDepth);
            }
            this.maximumNestingDepth = maximumNestingDepth;
            return this;
        }

        public Configuration build() {
            return new Configuration(dotMatchesLineTerminators, maximumStates, maximumNestingDepth);
        }
    }
}
