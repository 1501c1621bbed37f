package software.amazon.nfa;

import software.amazon.nfa.input.Condition;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A leaf that consumes one symbol accepted by its condition. The condition may be epsilon, in which case the leaf
 * consumes nothing.
 */
public class SymbolNode extends PatternNode {

    private final Condition condition;

    SymbolNode(final Condition condition) {
        super(NodeType.SYMBOL);
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public List<PatternNode> children() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return condition.equals(((SymbolNode) o).condition);
    }

    @Override
    public int hashCode() {
        return condition.hashCode();
    }

    @Override
    public String toString() {
        return condition.toString();
    }
}
