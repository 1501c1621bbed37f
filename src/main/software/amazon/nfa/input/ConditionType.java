package software.amazon.nfa.input;

/**
 * The different kinds of Conditions a Transition can be labelled with.
 */
public enum ConditionType {
    NORMAL,
    RANGE,
    SPECIAL,
    CLASS,
    EPSILON
}
