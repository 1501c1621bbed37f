package software.amazon.nfa.input;

import static software.amazon.nfa.input.ConditionType.NORMAL;

/**
 * A Condition that accepts exactly one code point.
 */
public class SymbolCondition extends Condition {

    private final int codePoint;

    SymbolCondition(final int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("Invalid code point " + codePoint);
        }
        this.codePoint = codePoint;
    }

    public static SymbolCondition cast(Condition condition) {
        return (SymbolCondition) condition;
    }

    public int getCodePoint() {
        return codePoint;
    }

    @Override
    public ConditionType getType() {
        return NORMAL;
    }

    @Override
    public boolean matches(final int codePoint) {
        return this.codePoint == codePoint;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || !(o.getClass() == getClass())) {
            return false;
        }
        return ((SymbolCondition) o).getCodePoint() == getCodePoint();
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(codePoint);
    }

    @Override
    String toClassMemberString() {
        return renderBracketed(codePoint);
    }

    @Override
    public String toString() {
        return render(codePoint);
    }
}
