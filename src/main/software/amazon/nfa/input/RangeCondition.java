package software.amazon.nfa.input;

import java.util.Objects;

import static software.amazon.nfa.input.ConditionType.RANGE;

/**
 * A Condition that accepts every code point between two bounds, both inclusive.
 */
public class RangeCondition extends Condition {

    private final int from;
    private final int to;

    RangeCondition(final int from, final int to) {
        if (!Character.isValidCodePoint(from) || !Character.isValidCodePoint(to)) {
            throw new IllegalArgumentException("Invalid code point range " + from + "-" + to);
        }
        if (from > to) {
            throw new IllegalArgumentException("Range start " + from + " is after range end " + to);
        }
        this.from = from;
        this.to = to;
    }

    public static RangeCondition cast(Condition condition) {
        return (RangeCondition) condition;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    @Override
    public ConditionType getType() {
        return RANGE;
    }

    @Override
    public boolean matches(final int codePoint) {
        return from <= codePoint && codePoint <= to;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        RangeCondition other = (RangeCondition) o;
        return other.from == from && other.to == to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return renderBracketed(from) + "-" + renderBracketed(to);
    }
}
