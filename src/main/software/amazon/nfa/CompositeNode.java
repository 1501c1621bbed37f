package software.amazon.nfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A concatenation or alternation of any number of operands. A concatenation without operands is the empty pattern,
 * and an alternation without operands is the pattern that matches nothing.
 */
public class CompositeNode extends PatternNode {

    private final List<PatternNode> children;

    CompositeNode(final NodeType type, final List<PatternNode> children) {
        super(type);
        if (type != NodeType.CONCATENATION && type != NodeType.ALTERNATION) {
            throw new IllegalArgumentException(type + " is not a composite operator");
        }
        for (PatternNode child : children) {
            Objects.requireNonNull(child, "child");
        }
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    @Override
    public List<PatternNode> children() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        CompositeNode other = (CompositeNode) o;
        return type() == other.type() && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type(), children);
    }

    @Override
    public String toString() {
        if (type() == NodeType.ALTERNATION) {
            if (children.isEmpty()) {
                return "(∅)";
            }
            return children.stream().map(Object::toString).collect(Collectors.joining("|", "(", ")"));
        }
        return children.stream().map(Object::toString).collect(Collectors.joining("", "(", ")"));
    }
}
