package software.amazon.nfa.input;

import static software.amazon.nfa.input.ConditionType.EPSILON;

/**
 * The Condition of a transition that consumes no input.
 */
public class EpsilonCondition extends Condition {

    static final EpsilonCondition INSTANCE = new EpsilonCondition();

    private EpsilonCondition() { }

    @Override
    public ConditionType getType() {
        return EPSILON;
    }

    @Override
    public boolean matches(final int codePoint) {
        throw new IllegalStateException("Epsilon transitions do not consume input");
    }

    @Override
    public boolean equals(Object o) {
        return o != null && o.getClass() == getClass();
    }

    @Override
    public int hashCode() {
        return EpsilonCondition.class.hashCode();
    }

    @Override
    public String toString() {
        return "\\e";
    }
}
