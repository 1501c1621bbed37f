package software.amazon.nfa;

import software.amazon.nfa.input.Condition;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * A directed edge from one state to another, labelled with the condition an input symbol must meet, or with epsilon.
 */
@Immutable
@ThreadSafe
public class Transition {

    private final int from;
    private final Condition condition;
    private final int to;

    Transition(final int from, final Condition condition, final int to) {
        this.from = from;
        this.condition = condition;
        this.to = to;
    }

    public int getFrom() {
        return from;
    }

    public Condition getCondition() {
        return condition;
    }

    public int getTo() {
        return to;
    }

    public boolean isEpsilon() {
        return condition.isEpsilon();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition other = (Transition) o;
        return from == other.from && to == other.to && condition.equals(other.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, condition, to);
    }

    @Override
    public String toString() {
        return from + "->" + to + " " + condition;
    }
}
