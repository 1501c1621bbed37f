package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs inputs through an automaton. All nondeterministic branches are followed at once by tracking the set of states
 * the automaton could be in after each input symbol, so a run takes O(input length * automaton size) time and never
 * backtracks.
 *
 * A run stops as soon as the set of active states becomes empty, since no further input can lead to acceptance.
 * Every mode below does this.
 *
 * The simulator holds nothing but the automaton and its initial active states, both immutable. Each call works on
 * its own sets, so one simulator can serve any number of threads.
 */
@Immutable
@ThreadSafe
public class Simulator {

    private static final int NO_PARENT = -1;

    private final Nfa nfa;

    // epsilon closure of the start state, the active states before any input
    private final IntSet initialStates;

    public Simulator(@Nonnull final Nfa nfa) {
        this.nfa = Objects.requireNonNull(nfa, "nfa");
        this.initialStates = IntSets.unmodifiable(nfa.epsilonClosure(IntSets.singleton(nfa.getStartState())));
    }

    public Nfa getNfa() {
        return nfa;
    }

    /**
     * Full match: the whole input has to be consumed, ending in an accepting state.
     *
     * @param input input sequence of code points
     * @return true if the automaton accepts the input
     */
    public boolean matches(@Nonnull final CharSequence input) {
        IntSet active = initialStates;
        int i = 0;
        while (i < input.length()) {
            if (active.isEmpty()) {
                return false;
            }
            final int codePoint = Character.codePointAt(input, i);
            active = advance(active, codePoint);
            i += Character.charCount(codePoint);
        }
        return nfa.containsAccepting(active);
    }

    /**
     * Search from the beginning of the input.
     *
     * @see #find(CharSequence, int)
     */
    public MatchSpan find(@Nonnull final CharSequence input) {
        return find(input, 0);
    }

    /**
     * Search: finds the leftmost span of the input, starting at or after from, that the automaton accepts. Of the
     * spans starting at that offset the longest is returned. Each candidate start offset is simulated separately,
     * so the search is O(n^2 * automaton size) in the worst case.
     *
     * @param input input sequence of code points
     * @param from char offset to start searching at, between 0 and input.length(); must not fall between the two
     *             chars of a surrogate pair
     * @return the leftmost-longest accepted span, or null if no span is accepted
     * @throws IllegalArgumentException if from is out of range or splits a surrogate pair
     */
    public MatchSpan find(@Nonnull final CharSequence input, final int from) {
        if (from < 0 || from > input.length()) {
            throw new IllegalArgumentException("Offset " + from + " outside input of length " + input.length());
        }
        if (from > 0 && from < input.length() && Character.isLowSurrogate(input.charAt(from))
                && Character.isHighSurrogate(input.charAt(from - 1))) {
            throw new IllegalArgumentException("Offset " + from + " splits a surrogate pair");
        }
        int start = from;
        while (true) {
            final int end = longestMatchFrom(input, start);
            if (end >= 0) {
                return new MatchSpan(start, end);
            }
            if (start == input.length()) {
                return null;
            }
            start += Character.charCount(Character.codePointAt(input, start));
        }
    }

    /**
     * Finds all non-overlapping leftmost-longest spans, left to right. After an empty span the next search starts one
     * code point further along.
     *
     * @param input input sequence of code points
     * @return the spans in input order; empty if there are none
     */
    public List<MatchSpan> findAll(@Nonnull final CharSequence input) {
        final List<MatchSpan> spans = new ArrayList<>();
        int from = 0;
        while (from <= input.length()) {
            final MatchSpan span = find(input, from);
            if (span == null) {
                break;
            }
            spans.add(span);
            if (!span.isEmpty()) {
                from = span.getEnd();
            } else if (span.getEnd() == input.length()) {
                break;
            } else {
                from = span.getEnd() + Character.charCount(Character.codePointAt(input, span.getEnd()));
            }
        }
        return spans;
    }

    /**
     * Full match that also reports how the input was accepted. Runs the same simulation as matches() but remembers,
     * for every state reached at every input position, the state it was first reached from. Needs memory in
     * O(input length * automaton size).
     *
     * @param input input sequence of code points
     * @return a path from the start state to an accepting state consuming exactly the input, or null if the input is
     * rejected
     */
    public Path exec(@Nonnull final CharSequence input) {
        // For position p: the state each reached state came from, and which of them were reached by epsilon.
        final List<Int2IntMap> parents = new ArrayList<>();
        final List<IntSet> reachedByEpsilon = new ArrayList<>();
        final List<String> symbols = new ArrayList<>();

        Int2IntMap positionParents = newParentMap();
        IntSet positionEpsilon = new IntOpenHashSet();
        positionParents.put(nfa.getStartState(), NO_PARENT);
        IntSet active = new IntOpenHashSet();
        active.add(nfa.getStartState());
        closeWithParents(active, positionParents, positionEpsilon);
        parents.add(positionParents);
        reachedByEpsilon.add(positionEpsilon);

        int i = 0;
        while (i < input.length()) {
            if (active.isEmpty()) {
                return null;
            }
            final int codePoint = Character.codePointAt(input, i);
            positionParents = newParentMap();
            positionEpsilon = new IntOpenHashSet();
            final IntSet next = new IntOpenHashSet();
            for (int state : sorted(active)) {
                for (Transition transition : nfa.getTransitions(state)) {
                    if (!transition.isEpsilon() && transition.getCondition().matches(codePoint)
                            && next.add(transition.getTo())) {
                        positionParents.put(transition.getTo(), state);
                    }
                }
            }
            closeWithParents(next, positionParents, positionEpsilon);
            parents.add(positionParents);
            reachedByEpsilon.add(positionEpsilon);
            symbols.add(new String(Character.toChars(codePoint)));
            active = next;
            i += Character.charCount(codePoint);
        }

        final IntSet accepted = new IntOpenHashSet();
        SetOperations.intersection(active, nfa.getAcceptingStates(), accepted);
        if (accepted.isEmpty()) {
            return null;
        }
        return tracePath(sorted(accepted)[0], parents, reachedByEpsilon, symbols);
    }

    private IntSet advance(final IntSet active, final int codePoint) {
        return nfa.epsilonClosure(nfa.step(active, codePoint));
    }

    /**
     * @return the char offset at which the longest accepted span starting at start ends, or -1 if there is none
     */
    private int longestMatchFrom(final CharSequence input, final int start) {
        IntSet active = initialStates;
        int longest = nfa.containsAccepting(active) ? start : -1;
        int i = start;
        while (i < input.length() && !active.isEmpty()) {
            final int codePoint = Character.codePointAt(input, i);
            active = advance(active, codePoint);
            i += Character.charCount(codePoint);
            if (nfa.containsAccepting(active)) {
                longest = i;
            }
        }
        return longest;
    }

    /**
     * Epsilon closure that records the parent of each newly reached state. Breadth first, so every state is reached
     * by the shortest epsilon chain from the states that were active on entry.
     */
    private void closeWithParents(final IntSet active, final Int2IntMap positionParents,
                                  final IntSet positionEpsilon) {
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue(active.size());
        for (int state : sorted(active)) {
            queue.enqueue(state);
        }
        while (!queue.isEmpty()) {
            final int state = queue.dequeueInt();
            for (Transition transition : nfa.getTransitions(state)) {
                if (transition.isEpsilon() && active.add(transition.getTo())) {
                    positionParents.put(transition.getTo(), state);
                    positionEpsilon.add(transition.getTo());
                    queue.enqueue(transition.getTo());
                }
            }
        }
    }

    private Path tracePath(final int acceptingState, final List<Int2IntMap> parents,
                           final List<IntSet> reachedByEpsilon, final List<String> symbols) {
        final List<Integer> states = new ArrayList<>();
        final List<String> consumes = new ArrayList<>();
        int state = acceptingState;
        int position = parents.size() - 1;
        states.add(state);
        while (true) {
            final int parent = parents.get(position).get(state);
            if (parent == NO_PARENT) {
                break;
            }
            if (reachedByEpsilon.get(position).contains(state)) {
                consumes.add("");
            } else {
                consumes.add(symbols.get(position - 1));
                position--;
            }
            state = parent;
            states.add(state);
        }
        Collections.reverse(states);
        Collections.reverse(consumes);
        return new Path(states, consumes);
    }

    private static Int2IntMap newParentMap() {
        final Int2IntMap map = new Int2IntOpenHashMap();
        map.defaultReturnValue(NO_PARENT);
        return map;
    }

    private static int[] sorted(final IntSet states) {
        final int[] array = states.toIntArray();
        Arrays.sort(array);
        return array;
    }
}
