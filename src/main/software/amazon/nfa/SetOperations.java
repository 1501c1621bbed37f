package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;

class SetOperations {

    private SetOperations() { }

    /**
     * Tells if two sets of states share an element. This is optimized for performance as it iterates through the
     * smaller set.
     *
     * @param set1 First set.
     * @param set2 Second set.
     * @return True if and only if the intersection of the sets is not empty.
     */
    static boolean intersects(final IntSet set1, final IntSet set2) {
        IntSet smaller = set1.size() <= set2.size() ? set1 : set2;
        IntSet larger = set1.size() <= set2.size() ? set2 : set1;
        for (IntIterator iterator = smaller.iterator(); iterator.hasNext(); ) {
            if (larger.contains(iterator.nextInt())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Add each element of the intersection of two sets to a third set, iterating through the smaller set.
     *
     * @param set1 First set involved in intersection.
     * @param set2 Second set involved in intersection.
     * @param addTo Add intersection to this set.
     */
    static void intersection(final IntSet set1, final IntSet set2, final IntSet addTo) {
        IntSet smaller = set1.size() <= set2.size() ? set1 : set2;
        IntSet larger = set1.size() <= set2.size() ? set2 : set1;
        for (IntIterator iterator = smaller.iterator(); iterator.hasNext(); ) {
            int element = iterator.nextInt();
            if (larger.contains(element)) {
                addTo.add(element);
            }
        }
    }
}
