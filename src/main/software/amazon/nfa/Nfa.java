package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.List;

/**
 * A nondeterministic finite automaton over Unicode code points. States are the integers 0 to getStateCount() - 1.
 * Each state has an ordered list of outgoing transitions; a state may have several transitions whose conditions
 * accept the same symbol, and any number of epsilon transitions, which is where the nondeterminism comes from.
 *
 * An Nfa is created by {@link NfaBuilder#build()} and never changes afterwards. It holds no scratch state, so one
 * instance can be shared by any number of concurrent simulations.
 */
@Immutable
@ThreadSafe
public final class Nfa {

    private final int startState;
    private final IntSet acceptingStates;
    private final List<List<Transition>> transitions;
    private final int transitionCount;

    Nfa(final int startState, final IntSet acceptingStates, final List<List<Transition>> transitions) {
        this.startState = startState;
        this.acceptingStates = IntSets.unmodifiable(acceptingStates);
        this.transitions = transitions;
        int count = 0;
        for (List<Transition> outgoing : transitions) {
            count += outgoing.size();
        }
        this.transitionCount = count;
    }

    public int getStartState() {
        return startState;
    }

    public int getStateCount() {
        return transitions.size();
    }

    public int getTransitionCount() {
        return transitionCount;
    }

    public boolean isAccepting(final int state) {
        return acceptingStates.contains(state);
    }

    /**
     * @return the accepting states; empty for an automaton that never accepts
     */
    public IntSet getAcceptingStates() {
        return acceptingStates;
    }

    /**
     * @param state a state of this automaton
     * @return the transitions leaving the state, in the order they were added
     */
    public List<Transition> getTransitions(final int state) {
        checkState(state);
        return transitions.get(state);
    }

    /**
     * Tells if a set of states contains at least one accepting state.
     *
     * @param states states of this automaton
     * @return true if any of the states is accepting
     */
    public boolean containsAccepting(@Nonnull final IntSet states) {
        return SetOperations.intersects(states, acceptingStates);
    }

    /**
     * Computes the smallest superset of the given states that is closed under epsilon transitions. Uses a work list
     * and the result set as the visited marker, so epsilon cycles are followed once and the computation terminates
     * regardless of the automaton's shape.
     *
     * @param states states of this automaton; not modified
     * @return a new set holding the closure
     */
    public IntSet epsilonClosure(@Nonnull final IntSet states) {
        final IntSet closure = new IntOpenHashSet(states);
        final IntArrayList pending = new IntArrayList(states.size());
        for (IntIterator iterator = states.iterator(); iterator.hasNext(); ) {
            int state = iterator.nextInt();
            checkState(state);
            pending.push(state);
        }
        while (!pending.isEmpty()) {
            final int state = pending.popInt();
            for (Transition transition : transitions.get(state)) {
                if (transition.isEpsilon() && closure.add(transition.getTo())) {
                    pending.push(transition.getTo());
                }
            }
        }
        return closure;
    }

    /**
     * Computes the states reachable from the given states by consuming exactly one symbol. Epsilon transitions are
     * not followed, neither before nor after the symbol.
     *
     * @param states states of this automaton; not modified
     * @param codePoint the symbol to consume
     * @return a new set holding the targets of every non-epsilon transition whose condition accepts the symbol; empty
     * if no transition fires
     */
    public IntSet step(@Nonnull final IntSet states, final int codePoint) {
        final IntSet next = new IntOpenHashSet();
        for (IntIterator iterator = states.iterator(); iterator.hasNext(); ) {
            final int state = iterator.nextInt();
            checkState(state);
            for (Transition transition : transitions.get(state)) {
                if (!transition.isEpsilon() && transition.getCondition().matches(codePoint)) {
                    next.add(transition.getTo());
                }
            }
        }
        return next;
    }

    private void checkState(final int state) {
        if (state < 0 || state >= transitions.size()) {
            throw new IllegalArgumentException("No state " + state + " in automaton with " + transitions.size()
                    + " states");
        }
    }

    /**
     * Renders the automaton in the form read by {@link software.amazon.nfa.input.NfaDescriptionParser}, one
     * transition per rule line.
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("type: nfa\n");
        sb.append("states: ").append(getStateCount()).append('\n');
        if (startState != 0) {
            sb.append("start: ").append(startState).append('\n');
        }
        final int[] accepting = acceptingStates.toIntArray();
        Arrays.sort(accepting);
        sb.append("final:");
        for (int state : accepting) {
            sb.append(' ').append(state);
        }
        sb.append('\n');
        sb.append("rules:\n");
        for (List<Transition> outgoing : transitions) {
            for (Transition transition : outgoing) {
                sb.append(transition).append('\n');
            }
        }
        return sb.toString();
    }
}
