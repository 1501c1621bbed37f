package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * A partially built piece of an automaton: one start state and the exit states that have not been wired to anything
 * yet. Only exists while ThompsonConstructor is running.
 */
final class Fragment {

    final int start;
    final IntList exits;

    Fragment(final int start, final IntList exits) {
        this.start = start;
        this.exits = exits;
    }

    Fragment(final int start, final int exit) {
        this(start, IntArrayList.wrap(new int[] { exit }));
    }

    /**
     * @return a fragment without exits; nothing can leave it, so it matches nothing
     */
    static Fragment closed(final int start) {
        return new Fragment(start, new IntArrayList());
    }
}
