package software.amazon.nfa;

/**
 * The operators a pattern tree is built from.
 */
public enum NodeType {
    SYMBOL,
    CONCATENATION,
    ALTERNATION,
    STAR,
    PLUS,
    OPTIONAL
}
