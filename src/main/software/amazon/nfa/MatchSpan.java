package software.amazon.nfa;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * Where a search found a match: the char offsets [start, end) of the input.
 */
@Immutable
@ThreadSafe
public class MatchSpan {

    private final int start;
    private final int end;

    MatchSpan(final int start, final int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + "," + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * @return the matched part of the input
     */
    public String extract(final CharSequence input) {
        return input.subSequence(start, end).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchSpan other = (MatchSpan) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
