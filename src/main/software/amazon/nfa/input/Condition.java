package software.amazon.nfa.input;

import java.util.List;

/**
 * What a transition requires of a single input symbol. Input symbols are Unicode code points. A condition is either
 * a predicate over one code point, or the epsilon marker, which consumes no input at all.
 *
 * Conditions are immutable values; two conditions that accept the same symbols by the same definition are equal.
 */
public abstract class Condition {

    Condition() { }

    public abstract ConditionType getType();

    /**
     * Tells if this condition accepts the given code point.
     *
     * @param codePoint the input symbol
     * @return true if a transition labelled with this condition may consume the symbol
     * @throws IllegalStateException if this is the epsilon condition, which never consumes a symbol
     */
    public abstract boolean matches(int codePoint);

    public boolean isEpsilon() {
        return getType() == ConditionType.EPSILON;
    }

    public static Condition symbol(final int codePoint) {
        return new SymbolCondition(codePoint);
    }

    public static Condition range(final int from, final int to) {
        return new RangeCondition(from, to);
    }

    public static Condition special(final char name) {
        return SpecialCondition.of(name);
    }

    public static Condition characterClass(final boolean negated, final List<Condition> members) {
        return new CharacterClassCondition(negated, members);
    }

    public static Condition epsilon() {
        return EpsilonCondition.INSTANCE;
    }

    /**
     * @return how this condition is written as a member of a bracket class
     */
    String toClassMemberString() {
        return toString();
    }

    /**
     * Writes a code point so that it never breaks a line. Newline, tab, carriage return, form feed and backslash get
     * their usual backslash escapes; other control characters are written as a backslash, 'u' and four hex digits.
     */
    static String render(final int codePoint) {
        switch (codePoint) {
            case '\n':
                return "\\n";
            case '\t':
                return "\\t";
            case '\r':
                return "\\r";
            case '\f':
                return "\\f";
            case PatternParser.BACKSLASH_CHAR:
                return "\\\\";
            default:
                if (Character.isISOControl(codePoint)) {
                    return String.format("\\u%04x", codePoint);
                }
                return new String(Character.toChars(codePoint));
        }
    }

    /**
     * Like render(), but also escapes the characters that delimit ranges and bracket classes, and the space that
     * separates conditions.
     */
    static String renderBracketed(final int codePoint) {
        switch (codePoint) {
            case ' ':
                return "\\u0020";
            case PatternParser.HYPHEN_CHAR:
            case PatternParser.LEFT_SQUARE_BRACKET_CHAR:
            case PatternParser.RIGHT_SQUARE_BRACKET_CHAR:
            case PatternParser.CARET_CHAR:
                return "\\" + (char) codePoint;
            default:
                return render(codePoint);
        }
    }
}
