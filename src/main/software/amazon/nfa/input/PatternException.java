package software.amazon.nfa.input;

/**
 * A RuntimeException that indicates an error parsing or constructing a pattern. Carries the position of the
 * offending character (or line, for automaton descriptions).
 */
public class PatternException extends RuntimeException {

    private final int position;

    public PatternException(String description, int position) {
        super(description + " at pos " + position);
        this.position = position;
    }

    public PatternException(String description, int position, Throwable cause) {
        super(description + " at pos " + position, cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
