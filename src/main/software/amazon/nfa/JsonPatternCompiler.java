package software.amazon.nfa;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import software.amazon.nfa.input.PatternException;
import software.amazon.nfa.input.PatternParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a pattern tree described by a JSON document. Useful when patterns are produced by another program and the
 * escaping rules of the pattern text syntax get in the way. The forms are:
 *
 * <pre>
 *   "abc"                          the literal text abc, no metacharacters
 *   { "pattern": "a|b*" }          pattern text, see {@link PatternParser}
 *   { "concat": [ x, y, ... ] }    concatenation; [] is the empty pattern
 *   { "or": [ x, y, ... ] }        alternation; [] matches nothing
 *   { "star": x }                  zero or more
 *   { "plus": x }                  one or more
 *   { "optional": x }              zero or one
 *   { "range": [ "a", "z" ] }      one character between a and z
 *   { "special": "d" }             one of d w s D W S .
 *   { "epsilon": true }            consumes nothing
 * </pre>
 *
 * For example, ab(c|d)* is
 *
 * <pre>
 *   { "concat": [ "ab", { "star": { "or": [ "c", "d" ] } } ] }
 * </pre>
 *
 * Every object has exactly one key. Structural problems are reported as a JsonParseException with the location in the
 * source; problems in embedded pattern text as a {@link PatternException}.
 */
public class JsonPatternCompiler {

    static final String PATTERN_KEY = "pattern";
    static final String CONCAT_KEY = "concat";
    static final String OR_KEY = "or";
    static final String STAR_KEY = "star";
    static final String PLUS_KEY = "plus";
    static final String OPTIONAL_KEY = "optional";
    static final String RANGE_KEY = "range";
    static final String SPECIAL_KEY = "special";
    static final String EPSILON_KEY = "epsilon";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a JSON pattern tree
     * @param source pattern tree, as a String
     * @return null if the tree is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Parse a pattern tree from its JSON form.
     *
     * @param source pattern tree, as a String
     * @return the tree, ready for {@link NfaCompiler#compile(PatternNode)}
     * @throws IOException if the JSON isn't a valid pattern tree
     */
    public static PatternNode compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
    }

    public static PatternNode compile(final String source, final Configuration configuration) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), new PatternParser(configuration));
    }

    public static PatternNode compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
    }

    public static PatternNode compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
    }

    public static PatternNode compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source), PatternParser.getParser());
    }

    private static PatternNode doCompile(final JsonParser parser, final PatternParser patternParser)
            throws IOException {
        try {
            final PatternNode tree = parseNode(parser, parser.nextToken(), patternParser);
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after the pattern tree");
            }
            return tree;
        } finally {
            parser.close();
        }
    }

    private static PatternNode parseNode(final JsonParser parser, final JsonToken token,
                                         final PatternParser patternParser) throws IOException {
        if (token == JsonToken.VALUE_STRING) {
            return Patterns.literal(parser.getText());
        }
        if (token != JsonToken.START_OBJECT) {
            barf(parser, "Pattern tree node must be a string or an object");
        }
        if (parser.nextToken() != JsonToken.FIELD_NAME) {
            barf(parser, "Empty objects are not allowed");
        }
        final String operator = parser.getCurrentName();
        final JsonToken operand = parser.nextToken();
        final PatternNode node;
        switch (operator) {
            case PATTERN_KEY:
                node = patternParser.parse(stringOperand(parser, operand, operator));
                break;
            case CONCAT_KEY:
                node = Patterns.concatenation(parseArray(parser, operand, operator, patternParser));
                break;
            case OR_KEY:
                node = Patterns.alternation(parseArray(parser, operand, operator, patternParser));
                break;
            case STAR_KEY:
                node = Patterns.star(parseNode(parser, operand, patternParser));
                break;
            case PLUS_KEY:
                node = Patterns.plus(parseNode(parser, operand, patternParser));
                break;
            case OPTIONAL_KEY:
                node = Patterns.optional(parseNode(parser, operand, patternParser));
                break;
            case RANGE_KEY:
                node = parseRange(parser, operand);
                break;
            case SPECIAL_KEY:
                node = parseSpecial(parser, stringOperand(parser, operand, operator));
                break;
            case EPSILON_KEY:
                if (operand != JsonToken.VALUE_TRUE) {
                    barf(parser, "\"" + EPSILON_KEY + "\" must be true");
                }
                node = Patterns.epsilon();
                break;
            default:
                barf(parser, "Unknown operator \"" + operator + "\"");
                return null;
        }
        if (parser.nextToken() != JsonToken.END_OBJECT) {
            barf(parser, "Only one key allowed in pattern tree node");
        }
        return node;
    }

    private static List<PatternNode> parseArray(final JsonParser parser, final JsonToken token,
                                                final String operator, final PatternParser patternParser)
            throws IOException {
        if (token != JsonToken.START_ARRAY) {
            barf(parser, "Value of \"" + operator + "\" must be an array");
        }
        final List<PatternNode> operands = new ArrayList<>();
        JsonToken next;
        while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
            operands.add(parseNode(parser, next, patternParser));
        }
        return operands;
    }

    private static PatternNode parseRange(final JsonParser parser, final JsonToken token) throws IOException {
        if (token != JsonToken.START_ARRAY) {
            barf(parser, "Value of \"" + RANGE_KEY + "\" must be an array");
        }
        final int from = singleCodePoint(parser, parser.nextToken());
        final int to = singleCodePoint(parser, parser.nextToken());
        if (parser.nextToken() != JsonToken.END_ARRAY) {
            barf(parser, "\"" + RANGE_KEY + "\" must have exactly two elements");
        }
        if (from > to) {
            barf(parser, "Range start is after range end");
        }
        return Patterns.range(from, to);
    }

    private static PatternNode parseSpecial(final JsonParser parser, final String name) throws IOException {
        try {
            if (name.length() != 1) {
                throw new IllegalArgumentException("Unknown special character class " + name);
            }
            return Patterns.special(name.charAt(0));
        } catch (IllegalArgumentException e) {
            barf(parser, e.getMessage());
            return null;
        }
    }

    private static int singleCodePoint(final JsonParser parser, final JsonToken token) throws IOException {
        if (token != JsonToken.VALUE_STRING) {
            barf(parser, "\"" + RANGE_KEY + "\" bounds must be strings");
        }
        final String text = parser.getText();
        if (text.isEmpty() || text.codePointCount(0, text.length()) != 1) {
            barf(parser, "\"" + RANGE_KEY + "\" bounds must be single characters");
        }
        return text.codePointAt(0);
    }

    private static String stringOperand(final JsonParser parser, final JsonToken token, final String operator)
            throws IOException {
        if (token != JsonToken.VALUE_STRING) {
            barf(parser, "Value of \"" + operator + "\" must be a string");
        }
        return parser.getText();
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
