package software.amazon.nfa.input;

import static software.amazon.nfa.input.ConditionType.SPECIAL;

/**
 * A Condition for one of the predefined character classes: \d \w \s, their complements \D \W \S, and "." which
 * accepts anything but a line terminator. Only ASCII characters belong to the non-complemented classes.
 */
public class SpecialCondition extends Condition {

    private static final SpecialCondition DIGIT = new SpecialCondition('d');
    private static final SpecialCondition NON_DIGIT = new SpecialCondition('D');
    private static final SpecialCondition WORD = new SpecialCondition('w');
    private static final SpecialCondition NON_WORD = new SpecialCondition('W');
    private static final SpecialCondition SPACE = new SpecialCondition('s');
    private static final SpecialCondition NON_SPACE = new SpecialCondition('S');
    private static final SpecialCondition ANY = new SpecialCondition('.');

    private final char name;

    private SpecialCondition(final char name) {
        this.name = name;
    }

    /**
     * @param name the letter following the backslash, or '.'
     * @return the condition for the class
     * @throws IllegalArgumentException if no class has this name
     */
    static SpecialCondition of(final char name) {
        switch (name) {
            case 'd':
                return DIGIT;
            case 'D':
                return NON_DIGIT;
            case 'w':
                return WORD;
            case 'W':
                return NON_WORD;
            case 's':
                return SPACE;
            case 'S':
                return NON_SPACE;
            case '.':
                return ANY;
            default:
                throw new IllegalArgumentException("Unknown special character class " + name);
        }
    }

    static boolean isSpecial(final int name) {
        return name == 'd' || name == 'D' || name == 'w' || name == 'W' || name == 's' || name == 'S' || name == '.';
    }

    public static SpecialCondition cast(Condition condition) {
        return (SpecialCondition) condition;
    }

    public char getName() {
        return name;
    }

    @Override
    public ConditionType getType() {
        return SPECIAL;
    }

    @Override
    public boolean matches(final int codePoint) {
        switch (name) {
            case 'd':
                return isDigit(codePoint);
            case 'D':
                return !isDigit(codePoint);
            case 'w':
                return isWord(codePoint);
            case 'W':
                return !isWord(codePoint);
            case 's':
                return isSpace(codePoint);
            case 'S':
                return !isSpace(codePoint);
            default:
                return codePoint != '\n' && codePoint != '\r';
        }
    }

    private static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWord(final int c) {
        return isDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isSpace(final int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    // Instances are interned by of(), so identity equality is enough.
    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return Character.hashCode(name);
    }

    @Override
    public String toString() {
        return "\\" + name;
    }
}
