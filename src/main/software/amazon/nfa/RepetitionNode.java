package software.amazon.nfa;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Zero-or-more (STAR), one-or-more (PLUS) or zero-or-one (OPTIONAL) occurrences of a single operand.
 */
public class RepetitionNode extends PatternNode {

    private final PatternNode child;

    RepetitionNode(final NodeType type, final PatternNode child) {
        super(type);
        if (type != NodeType.STAR && type != NodeType.PLUS && type != NodeType.OPTIONAL) {
            throw new IllegalArgumentException(type + " is not a repetition operator");
        }
        this.child = Objects.requireNonNull(child, "child");
    }

    public PatternNode getChild() {
        return child;
    }

    @Override
    public List<PatternNode> children() {
        return Collections.singletonList(child);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RepetitionNode other = (RepetitionNode) o;
        return type() == other.type() && child.equals(other.child);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type(), child);
    }

    @Override
    public String toString() {
        switch (type()) {
            case STAR:
                return child + "*";
            case PLUS:
                return child + "+";
            default:
                return child + "?";
        }
    }
}
