package software.amazon.nfa.input;

import software.amazon.nfa.Configuration;
import software.amazon.nfa.Nfa;
import software.amazon.nfa.NfaBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an automaton written out state by state, as in this example:
 *
 * <pre>
 *   type: nfa
 *   states: 3
 *   final: 2
 *   rules:
 *   0->1 a
 *   1->1 \e
 *   1->2 0-9 \d
 * </pre>
 *
 * States are numbered from 0 and the start state is 0 unless a "start:" line says otherwise. "states:" has to come
 * before "start:", "final:" and "rules:". Each rule line holds a source and a destination state followed by one or
 * more space separated conditions, each adding one transition:
 * <ul>
 *   <li>a single character, where a space is written as a space followed by the separating space;</li>
 *   <li>x-y, an inclusive range;</li>
 *   <li>\e, epsilon;</li>
 *   <li>\d \w \s \D \W \S or \., a predefined class ("\." accepts anything but a line terminator);</li>
 *   <li>[...] or [^...], a bracket class of characters, ranges and predefined classes.</li>
 * </ul>
 * Within a condition a character may be escaped: \n \t \r and \f are the control characters, a backslash and 'u'
 * followed by four hex digits is that code point, and a backslash before punctuation stands for the punctuation.
 * {@link Nfa#toString()} writes this format, escaping whatever would otherwise split a line or a condition.
 * Blank lines and "input:" lines are skipped.
 *
 * Errors are reported as a {@link PatternException} whose position is the 1-based line number.
 */
public class NfaDescriptionParser {

    private static final String TYPE_KEY = "type:";
    private static final String STATES_KEY = "states:";
    private static final String START_KEY = "start:";
    private static final String FINAL_KEY = "final:";
    private static final String RULES_KEY = "rules:";
    private static final String INPUT_KEY = "input:";
    private static final String ARROW = "->";
    private static final String NFA_TYPE = "nfa";
    private static final int HEX_DIGITS = 4;

    private NfaDescriptionParser() { }

    public static Nfa parse(final String description) {
        return parse(description, Configuration.defaults());
    }

    /**
     * @param description the automaton, in the format above
     * @param configuration supplies the largest number of states a description may declare
     * @return the automaton
     * @throws PatternException if the description is malformed or declares too many states
     */
    public static Nfa parse(final String description, final Configuration configuration) {
        final String[] lines = description.split("\r?\n", -1);
        NfaBuilder builder = null;
        String type = null;
        int start = 0;
        boolean readingRules = false;

        for (int i = 0; i < lines.length; i++) {
            final String line = lines[i];
            final int lineNumber = i + 1;
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(TYPE_KEY)) {
                type = line.substring(TYPE_KEY.length()).trim();
                continue;
            }
            if (!NFA_TYPE.equals(type)) {
                throw new PatternException("Description type is not " + NFA_TYPE, lineNumber);
            }

            if (line.startsWith(STATES_KEY)) {
                if (builder != null) {
                    throw new PatternException("Duplicate " + STATES_KEY, lineNumber);
                }
                final int count = parseState(line.substring(STATES_KEY.length()), lineNumber);
                if (count > configuration.getMaximumStates()) {
                    throw new PatternException("Automaton has " + count + " states, more than the maximum of "
                            + configuration.getMaximumStates(), lineNumber);
                }
                builder = new NfaBuilder();
                for (int state = 0; state < count; state++) {
                    builder.addState();
                }
                readingRules = false;
            } else if (line.startsWith(START_KEY)) {
                requireStates(builder, lineNumber);
                start = parseState(line.substring(START_KEY.length()), lineNumber);
                readingRules = false;
            } else if (line.startsWith(FINAL_KEY)) {
                requireStates(builder, lineNumber);
                for (String token : line.substring(FINAL_KEY.length()).trim().split(" ")) {
                    if (!token.isEmpty()) {
                        final int state = parseState(token, lineNumber);
                        try {
                            builder.setAccepting(state);
                        } catch (IllegalArgumentException e) {
                            throw new PatternException("Unknown final state " + state, lineNumber, e);
                        }
                    }
                }
                readingRules = false;
            } else if (line.startsWith(RULES_KEY)) {
                requireStates(builder, lineNumber);
                readingRules = true;
            } else if (line.startsWith(INPUT_KEY)) {
                readingRules = false;
            } else if (readingRules) {
                parseRule(builder, line, lineNumber);
            } else {
                throw new PatternException("Unexpected line", lineNumber);
            }
        }

        if (builder == null) {
            throw new PatternException("Missing " + STATES_KEY, lines.length);
        }
        try {
            builder.setStartState(start);
        } catch (IllegalArgumentException e) {
            throw new PatternException("Unknown start state " + start, lines.length, e);
        }
        return builder.build();
    }

    private static void parseRule(final NfaBuilder builder, final String line, final int lineNumber) {
        final int arrowPos = line.indexOf(ARROW);
        final int spacePos = line.indexOf(' ');
        if (arrowPos == -1 || spacePos == -1 || arrowPos > spacePos) {
            throw new PatternException("Invalid rule", lineNumber);
        }
        final int from = parseState(line.substring(0, arrowPos), lineNumber);
        final int to = parseState(line.substring(arrowPos + ARROW.length(), spacePos), lineNumber);

        String content = line.substring(spacePos + 1);
        if (content.isEmpty()) {
            throw new PatternException("Rule without conditions", lineNumber);
        }
        while (!content.isEmpty()) {
            int end = content.indexOf(' ');
            if (end == -1) {
                end = content.length();
            } else if (end == 0) {
                // the condition is a space, which has to be followed by the separator or the end of line
                end = 1;
                if (content.length() > 1 && content.charAt(1) != ' ') {
                    throw new PatternException("Invalid condition", lineNumber);
                }
            }
            final Condition condition = parseCondition(content.substring(0, end), lineNumber);
            try {
                builder.addTransition(from, condition, to);
            } catch (IllegalArgumentException e) {
                throw new PatternException("Unknown state in rule " + from + ARROW + to, lineNumber, e);
            }
            content = content.substring(Math.min(end + 1, content.length()));
        }
    }

    private static Condition parseCondition(final String token, final int lineNumber) {
        final int[] codePoints = token.codePoints().toArray();
        if (codePoints.length == 1) {
            return Condition.symbol(codePoints[0]);
        }
        if (codePoints[0] == PatternParser.LEFT_SQUARE_BRACKET_CHAR) {
            return parseClass(codePoints, token, lineNumber);
        }
        if (codePoints.length == 2 && codePoints[0] == PatternParser.BACKSLASH_CHAR) {
            if (codePoints[1] == 'e') {
                return Condition.epsilon();
            }
            if (SpecialCondition.isSpecial(codePoints[1])) {
                return Condition.special((char) codePoints[1]);
            }
            if (Character.isLetterOrDigit(codePoints[1]) && controlCharacter(codePoints[1]) < 0) {
                throw new PatternException("Unknown special character \\" + token.substring(1), lineNumber);
            }
        }
        final Position position = new Position();
        final Condition condition = parseRangeOrSymbol(codePoints, position, token, lineNumber);
        if (position.index != codePoints.length) {
            throw new PatternException("Invalid condition " + token, lineNumber);
        }
        return condition;
    }

    /**
     * Reads "[" "^"? member+ "]" where each member is a character, a range or a predefined class.
     */
    private static Condition parseClass(final int[] codePoints, final String token, final int lineNumber) {
        final Position position = new Position();
        position.index = 1;
        boolean negated = false;
        if (position.index < codePoints.length && codePoints[position.index] == PatternParser.CARET_CHAR) {
            negated = true;
            position.index++;
        }
        final List<Condition> members = new ArrayList<>();
        while (position.index < codePoints.length
                && codePoints[position.index] != PatternParser.RIGHT_SQUARE_BRACKET_CHAR) {
            final int c = codePoints[position.index];
            if (c == PatternParser.BACKSLASH_CHAR && position.index + 1 < codePoints.length
                    && SpecialCondition.isSpecial(codePoints[position.index + 1])) {
                members.add(Condition.special((char) codePoints[position.index + 1]));
                position.index += 2;
            } else {
                members.add(parseRangeOrSymbol(codePoints, position, token, lineNumber));
            }
        }
        if (members.isEmpty() || position.index != codePoints.length - 1) {
            throw new PatternException("Invalid condition " + token, lineNumber);
        }
        return Condition.characterClass(negated, members);
    }

    private static Condition parseRangeOrSymbol(final int[] codePoints, final Position position, final String token,
                                                final int lineNumber) {
        final int from = parseCharacter(codePoints, position, token, lineNumber);
        if (position.index + 1 < codePoints.length && codePoints[position.index] == PatternParser.HYPHEN_CHAR
                && codePoints[position.index + 1] != PatternParser.RIGHT_SQUARE_BRACKET_CHAR) {
            position.index++;
            final int to = parseCharacter(codePoints, position, token, lineNumber);
            if (from > to) {
                throw new PatternException("Invalid range " + token, lineNumber);
            }
            return Condition.range(from, to);
        }
        return Condition.symbol(from);
    }

    /**
     * Reads one character, either as is or as one of the escapes \n \t \r \f, a backslash and 'u' followed by
     * four hex digits, or a backslash followed by a punctuation character, which stands for itself.
     */
    private static int parseCharacter(final int[] codePoints, final Position position, final String token,
                                      final int lineNumber) {
        if (position.index >= codePoints.length) {
            throw new PatternException("Invalid condition " + token, lineNumber);
        }
        final int c = codePoints[position.index++];
        if (c != PatternParser.BACKSLASH_CHAR) {
            return c;
        }
        if (position.index >= codePoints.length) {
            throw new PatternException("Invalid condition " + token, lineNumber);
        }
        final int escaped = codePoints[position.index++];
        final int control = controlCharacter(escaped);
        if (control >= 0) {
            return control;
        }
        if (escaped == 'u') {
            if (position.index + HEX_DIGITS > codePoints.length) {
                throw new PatternException("Invalid condition " + token, lineNumber);
            }
            int value = 0;
            for (int i = 0; i < HEX_DIGITS; i++) {
                final int digit = Character.digit(codePoints[position.index++], 16);
                if (digit < 0) {
                    throw new PatternException("Invalid condition " + token, lineNumber);
                }
                value = value * 16 + digit;
            }
            return value;
        }
        if (Character.isLetterOrDigit(escaped)) {
            throw new PatternException("Invalid condition " + token, lineNumber);
        }
        return escaped;
    }

    private static int controlCharacter(final int escaped) {
        switch (escaped) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'f':
                return '\f';
            default:
                return -1;
        }
    }

    private static int parseState(final String value, final int lineNumber) {
        try {
            final int state = Integer.parseInt(value.trim());
            if (state < 0) {
                throw new PatternException("Negative state " + state, lineNumber);
            }
            return state;
        } catch (NumberFormatException e) {
            throw new PatternException("Invalid state number '" + value.trim() + "'", lineNumber, e);
        }
    }

    private static void requireStates(final NfaBuilder builder, final int lineNumber) {
        if (builder == null) {
            throw new PatternException(STATES_KEY + " must come first", lineNumber);
        }
    }

    private static final class Position {
        int index;
    }
}
