package software.amazon.nfa;

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A path through an automaton from its start state to an accepting state that spells out an accepted input. For
 * every hop from getStates().get(i) to getStates().get(i + 1), getConsumes().get(i) is the symbol consumed, or the
 * empty string for an epsilon hop.
 */
@Immutable
public class Path {

    private final List<Integer> states;
    private final List<String> consumes;

    Path(final List<Integer> states, final List<String> consumes) {
        if (states.isEmpty()) {
            throw new IllegalArgumentException("A path visits at least one state");
        }
        if (consumes.size() != states.size() - 1) {
            throw new IllegalArgumentException("Path with " + states.size() + " states must consume "
                    + (states.size() - 1) + " times, got " + consumes.size());
        }
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.consumes = Collections.unmodifiableList(new ArrayList<>(consumes));
    }

    public List<Integer> getStates() {
        return states;
    }

    public List<String> getConsumes() {
        return consumes;
    }

    /**
     * @return the input spelled by the path
     */
    public String getInput() {
        return String.join("", consumes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Path path = (Path) o;
        return states.equals(path.states) && consumes.equals(path.consumes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, consumes);
    }

    /**
     * Renders the path as "s0 c0 s1 c1 ... sn". An epsilon hop leaves an empty symbol between two spaces.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < consumes.size(); i++) {
            sb.append(states.get(i)).append(' ').append(consumes.get(i)).append(' ');
        }
        return sb.append(states.get(states.size() - 1)).toString();
    }
}
