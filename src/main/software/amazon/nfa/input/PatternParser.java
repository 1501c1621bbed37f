package software.amazon.nfa.input;

import software.amazon.nfa.Configuration;
import software.amazon.nfa.PatternNode;
import software.amazon.nfa.Patterns;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses pattern text into a pattern tree. The syntax is:
 *
 * <pre>
 *   alternation := sequence ('|' sequence)*
 *   sequence    := repeat*
 *   repeat      := atom ('*' | '+' | '?')*
 *   atom        := '(' alternation ')' | '[' class ']' | '.' | '\' escape | literal
 * </pre>
 *
 * Parentheses only group. Sequences may be empty, so "", "a|" and "()" all contain the empty pattern. The escapes
 * \d \D \w \W \s \S are the predefined classes, \n \t \r \f are control characters and \e is an explicit epsilon.
 * Any other escaped character that is not a letter or digit stands for itself.
 *
 * A bracket class holds literals, ranges such as a-z and escapes (except \e). A leading ^ negates the class. A '-'
 * that cannot form a range is a literal.
 *
 * Groups may be nested up to {@link Configuration#getMaximumNestingDepth()} deep.
 *
 * Errors are reported as a {@link PatternException} carrying the char offset of the offending character.
 */
@ThreadSafe
public class PatternParser {

    static final char ALTERNATION_CHAR = '|';
    static final char STAR_CHAR = '*';
    static final char PLUS_CHAR = '+';
    static final char QUESTION_MARK_CHAR = '?';
    static final char LEFT_PARENTHESIS_CHAR = '(';
    static final char RIGHT_PARENTHESIS_CHAR = ')';
    static final char LEFT_SQUARE_BRACKET_CHAR = '[';
    static final char RIGHT_SQUARE_BRACKET_CHAR = ']';
    static final char CARET_CHAR = '^';
    static final char HYPHEN_CHAR = '-';
    static final char PERIOD_CHAR = '.';
    static final char BACKSLASH_CHAR = '\\';

    private static final int END = -1;
    private static final PatternParser DEFAULT = new PatternParser(Configuration.defaults());

    private final Configuration configuration;

    public PatternParser(final Configuration configuration) {
        this.configuration = configuration;
    }

    public static PatternParser getParser() {
        return DEFAULT;
    }

    public PatternNode parse(final String pattern) {
        final Cursor cursor = new Cursor(pattern);
        final PatternNode result = parseAlternation(cursor);
        if (!cursor.atEnd()) {
            // parseSequence only stops early on ')'
            throw new PatternException("Unmatched closing parenthesis", cursor.pos);
        }
        return result;
    }

    private PatternNode parseAlternation(final Cursor cursor) {
        final List<PatternNode> branches = new ArrayList<>();
        branches.add(parseSequence(cursor));
        while (cursor.peek() == ALTERNATION_CHAR) {
            cursor.advance();
            branches.add(parseSequence(cursor));
        }
        return branches.size() == 1 ? branches.get(0) : Patterns.alternation(branches);
    }

    private PatternNode parseSequence(final Cursor cursor) {
        final List<PatternNode> items = new ArrayList<>();
        int c;
        while ((c = cursor.peek()) != END && c != ALTERNATION_CHAR && c != RIGHT_PARENTHESIS_CHAR) {
            items.add(parseRepeat(cursor));
        }
        return items.size() == 1 ? items.get(0) : Patterns.concatenation(items);
    }

    private PatternNode parseRepeat(final Cursor cursor) {
        if (isQuantifier(cursor.peek())) {
            throw new PatternException("Nothing to repeat", cursor.pos);
        }
        PatternNode node = parseAtom(cursor);
        int c;
        while (isQuantifier(c = cursor.peek())) {
            cursor.advance();
            if (c == STAR_CHAR) {
                node = Patterns.star(node);
            } else if (c == PLUS_CHAR) {
                node = Patterns.plus(node);
            } else {
                node = Patterns.optional(node);
            }
        }
        return node;
    }

    private PatternNode parseAtom(final Cursor cursor) {
        final int start = cursor.pos;
        final int c = cursor.peek();
        switch (c) {
            case LEFT_PARENTHESIS_CHAR:
                if (cursor.depth == configuration.getMaximumNestingDepth()) {
                    throw new PatternException("Pattern nested too deeply", start);
                }
                cursor.advance();
                cursor.depth++;
                PatternNode inner = parseAlternation(cursor);
                if (cursor.peek() != RIGHT_PARENTHESIS_CHAR) {
                    throw new PatternException("Unclosed group", start);
                }
                cursor.advance();
                cursor.depth--;
                return inner;
            case LEFT_SQUARE_BRACKET_CHAR:
                return Patterns.symbol(parseClass(cursor));
            case PERIOD_CHAR:
                cursor.advance();
                return Patterns.symbol(dot());
            case BACKSLASH_CHAR:
                return Patterns.symbol(parseEscape(cursor, false));
            default:
                cursor.advance();
                return Patterns.symbol(c);
        }
    }

    private Condition dot() {
        if (configuration.isDotMatchesLineTerminators()) {
            return Condition.range(0, Character.MAX_CODE_POINT);
        }
        return Condition.special(PERIOD_CHAR);
    }

    private Condition parseClass(final Cursor cursor) {
        final int open = cursor.pos;
        cursor.advance();
        boolean negated = false;
        if (cursor.peek() == CARET_CHAR) {
            negated = true;
            cursor.advance();
        }

        final List<Condition> members = new ArrayList<>();
        while (true) {
            int c = cursor.peek();
            if (c == END) {
                throw new PatternException("Unclosed character class", open);
            }
            if (c == RIGHT_SQUARE_BRACKET_CHAR) {
                if (members.isEmpty()) {
                    throw new PatternException("Empty character class", open);
                }
                cursor.advance();
                return Condition.characterClass(negated, members);
            }

            final int lowPos = cursor.pos;
            final Condition low = parseClassMember(cursor);
            if (low.getType() == ConditionType.NORMAL && cursor.peek() == HYPHEN_CHAR
                    && cursor.peekAfterNext() != END && cursor.peekAfterNext() != RIGHT_SQUARE_BRACKET_CHAR) {
                cursor.advance();
                final int highPos = cursor.pos;
                final Condition high = parseClassMember(cursor);
                if (high.getType() != ConditionType.NORMAL) {
                    throw new PatternException("Invalid range end", highPos);
                }
                final int from = SymbolCondition.cast(low).getCodePoint();
                final int to = SymbolCondition.cast(high).getCodePoint();
                if (from > to) {
                    throw new PatternException("Invalid range " + low + "-" + high, lowPos);
                }
                members.add(Condition.range(from, to));
            } else {
                members.add(low);
            }
        }
    }

    private Condition parseClassMember(final Cursor cursor) {
        if (cursor.peek() == BACKSLASH_CHAR) {
            return parseEscape(cursor, true);
        }
        return Condition.symbol(cursor.advance());
    }

    private Condition parseEscape(final Cursor cursor, final boolean inClass) {
        final int start = cursor.pos;
        cursor.advance();
        if (cursor.atEnd()) {
            throw new PatternException("Trailing backslash", start);
        }
        final int c = cursor.advance();
        switch (c) {
            case 'n':
                return Condition.symbol('\n');
            case 't':
                return Condition.symbol('\t');
            case 'r':
                return Condition.symbol('\r');
            case 'f':
                return Condition.symbol('\f');
            case 'e':
                if (inClass) {
                    throw new PatternException("Invalid escape character", start);
                }
                return Condition.epsilon();
            default:
                if (c != PERIOD_CHAR && SpecialCondition.isSpecial(c)) {
                    return Condition.special((char) c);
                }
                if (Character.isLetterOrDigit(c)) {
                    throw new PatternException("Invalid escape character", start);
                }
                return Condition.symbol(c);
        }
    }

    private static boolean isQuantifier(final int c) {
        return c == STAR_CHAR || c == PLUS_CHAR || c == QUESTION_MARK_CHAR;
    }

    /**
     * Reads a pattern one code point at a time. Positions are char offsets.
     */
    private static final class Cursor {

        private final String pattern;
        private int pos = 0;
        // groups open at pos
        private int depth = 0;

        Cursor(final String pattern) {
            this.pattern = pattern;
        }

        boolean atEnd() {
            return pos >= pattern.length();
        }

        int peek() {
            return atEnd() ? END : pattern.codePointAt(pos);
        }

        int peekAfterNext() {
            if (atEnd()) {
                return END;
            }
            int next = pos + Character.charCount(pattern.codePointAt(pos));
            return next >= pattern.length() ? END : pattern.codePointAt(next);
        }

        int advance() {
            int c = pattern.codePointAt(pos);
            pos += Character.charCount(c);
            return c;
        }
    }
}
