package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import software.amazon.nfa.input.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable construction phase of an {@link Nfa}. States and transitions are added here, then {@link #build()} turns
 * the builder into an immutable automaton. A builder can only be built once; any use after that is rejected, so
 * nothing can reach into an automaton that is already in use.
 *
 * Not thread safe.
 */
public class NfaBuilder {

    private final List<List<Transition>> transitions = new ArrayList<>();
    private final IntSet acceptingStates = new IntOpenHashSet();
    private int startState = -1;
    private boolean built = false;

    /**
     * @return the id of the new state
     */
    public int addState() {
        checkNotBuilt();
        transitions.add(new ArrayList<>());
        return transitions.size() - 1;
    }

    public NfaBuilder addTransition(final int from, final Condition condition, final int to) {
        checkNotBuilt();
        Objects.requireNonNull(condition, "condition");
        checkState(from);
        checkState(to);
        transitions.get(from).add(new Transition(from, condition, to));
        return this;
    }

    public NfaBuilder addEpsilonTransition(final int from, final int to) {
        return addTransition(from, Condition.epsilon(), to);
    }

    public NfaBuilder setStartState(final int state) {
        checkNotBuilt();
        checkState(state);
        startState = state;
        return this;
    }

    public NfaBuilder setAccepting(final int state) {
        checkNotBuilt();
        checkState(state);
        acceptingStates.add(state);
        return this;
    }

    public int getStateCount() {
        return transitions.size();
    }

    /**
     * @return the automaton holding every state and transition added so far
     * @throws IllegalStateException if no start state was set, or the builder was already built
     */
    public Nfa build() {
        checkNotBuilt();
        if (startState < 0) {
            throw new IllegalStateException("Start state has not been set");
        }
        built = true;
        final List<List<Transition>> frozen = new ArrayList<>(transitions.size());
        for (List<Transition> outgoing : transitions) {
            frozen.add(Collections.unmodifiableList(new ArrayList<>(outgoing)));
        }
        return new Nfa(startState, new IntOpenHashSet(acceptingStates), Collections.unmodifiableList(frozen));
    }

    private void checkState(final int state) {
        if (state < 0 || state >= transitions.size()) {
            throw new IllegalArgumentException("No state " + state + ", builder has " + transitions.size()
                    + " states");
        }
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("Automaton has already been built");
        }
    }
}
