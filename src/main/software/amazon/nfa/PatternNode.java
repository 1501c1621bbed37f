package software.amazon.nfa;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * A node of a parsed pattern: an operator and its operands. Trees are immutable and can be built by hand through the
 * factories in {@link Patterns}, from pattern text through {@link software.amazon.nfa.input.PatternParser}, or from
 * JSON through {@link JsonPatternCompiler}.
 */
public abstract class PatternNode {

    private final NodeType type;

    PatternNode(final NodeType type) {
        this.type = type;
    }

    public NodeType type() {
        return type;
    }

    /**
     * @return the operands of this node, in order; empty for a symbol
     */
    public abstract List<PatternNode> children();

    /**
     * @return the number of nodes in the tree rooted here
     */
    public int size() {
        int size = 0;
        final Deque<PatternNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            size++;
            for (PatternNode child : pending.pop().children()) {
                pending.push(child);
            }
        }
        return size;
    }
}
