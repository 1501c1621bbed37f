package software.amazon.nfa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds an automaton from a pattern tree by Thompson's construction: every operator combines the fragments of its
 * operands with a constant number of new states and one or two epsilon transitions per dangling exit. The result has
 * at most two states per tree node.
 *
 * Each instance writes into its own NfaBuilder and is used for a single construction.
 */
class ThompsonConstructor {

    private final NfaBuilder builder = new NfaBuilder();

    Nfa construct(final PatternNode root) {
        final Fragment fragment = visit(root);
        for (int i = 0; i < fragment.exits.size(); i++) {
            builder.setAccepting(fragment.exits.getInt(i));
        }
        builder.setStartState(fragment.start);
        return builder.build();
    }

    /**
     * Counts the states construct() would create for a tree, without creating them. Each node adds a fixed number
     * of states of its own, so the nodes are simply walked and summed.
     */
    static long countStates(final PatternNode root) {
        long count = 0;
        final Deque<PatternNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final PatternNode node = pending.pop();
            for (PatternNode child : node.children()) {
                pending.push(child);
            }
            switch (node.type()) {
                case SYMBOL:
                    count += 2;
                    break;
                case CONCATENATION:
                    count += node.children().isEmpty() ? 1 : 0;
                    break;
                case ALTERNATION:
                    count += 1;
                    break;
                case STAR:
                case PLUS:
                case OPTIONAL:
                    // the new start, and the new exit or the empty branch
                    count += 2;
                    break;
                default:
                    throw new AssertionError(node.type() + " is not implemented yet");
            }
        }
        return count;
    }

    /**
     * Post-order walk with an explicit stack, so deeply nested trees don't exhaust the call stack. States are
     * allocated in the same order a recursive walk would use: an alternation's start before its branches, every
     * other operator's new states after its operands.
     */
    private Fragment visit(final PatternNode root) {
        final Deque<Visit> pending = new ArrayDeque<>();
        pending.push(enter(root));
        while (true) {
            final Visit visit = pending.peek();
            final List<PatternNode> children = visit.node.children();
            if (visit.operands.size() < children.size()) {
                pending.push(enter(children.get(visit.operands.size())));
                continue;
            }
            pending.pop();
            final Fragment fragment = leave(visit);
            if (pending.isEmpty()) {
                return fragment;
            }
            pending.peek().operands.add(fragment);
        }
    }

    private Visit enter(final PatternNode node) {
        final int start = node.type() == NodeType.ALTERNATION ? builder.addState() : -1;
        return new Visit(node, start);
    }

    private Fragment leave(final Visit visit) {
        switch (visit.node.type()) {
            case SYMBOL:
                return symbol((SymbolNode) visit.node);
            case CONCATENATION:
                return concatenation(visit.operands);
            case ALTERNATION:
                return alternation(visit.start, visit.operands);
            case STAR:
                return repeat(visit.operands.get(0), true);
            case PLUS:
                return repeat(visit.operands.get(0), false);
            case OPTIONAL:
                return optional(visit.operands.get(0));
            default:
                throw new AssertionError(visit.node.type() + " is not implemented yet");
        }
    }

    private Fragment symbol(final SymbolNode node) {
        final int start = builder.addState();
        final int exit = builder.addState();
        builder.addTransition(start, node.getCondition(), exit);
        return new Fragment(start, exit);
    }

    private Fragment empty() {
        final int state = builder.addState();
        return new Fragment(state, state);
    }

    private Fragment concatenation(final List<Fragment> operands) {
        if (operands.isEmpty()) {
            return empty();
        }
        final Fragment first = operands.get(0);
        IntList exits = first.exits;
        for (int i = 1; i < operands.size(); i++) {
            final Fragment next = operands.get(i);
            connect(exits, next.start);
            exits = next.exits;
        }
        return new Fragment(first.start, exits);
    }

    private Fragment alternation(final int start, final List<Fragment> branches) {
        final IntList exits = new IntArrayList();
        for (Fragment branch : branches) {
            builder.addEpsilonTransition(start, branch.start);
            exits.addAll(branch.exits);
        }
        return exits.isEmpty() ? Fragment.closed(start) : new Fragment(start, exits);
    }

    private Fragment optional(final Fragment operand) {
        final int start = builder.addState();
        final Fragment bypass = empty();
        builder.addEpsilonTransition(start, operand.start);
        builder.addEpsilonTransition(start, bypass.start);
        // the operand's exit list is not used again, so it is extended in place
        final IntList exits = operand.exits;
        exits.addAll(bypass.exits);
        return new Fragment(start, exits);
    }

    /**
     * Wires a loop around the operand. Every exit of the operand goes back to its start and on to a new exit. With
     * allowEmpty the new start also goes straight to the new exit (A*); without it the operand has to be passed at
     * least once (A+, the same language as A followed by A*).
     */
    private Fragment repeat(final Fragment operand, final boolean allowEmpty) {
        final int start = builder.addState();
        final int exit = builder.addState();
        builder.addEpsilonTransition(start, operand.start);
        if (allowEmpty) {
            builder.addEpsilonTransition(start, exit);
        }
        for (int i = 0; i < operand.exits.size(); i++) {
            final int operandExit = operand.exits.getInt(i);
            builder.addEpsilonTransition(operandExit, operand.start);
            builder.addEpsilonTransition(operandExit, exit);
        }
        return new Fragment(start, exit);
    }

    private void connect(final IntList exits, final int target) {
        for (int i = 0; i < exits.size(); i++) {
            builder.addEpsilonTransition(exits.getInt(i), target);
        }
    }

    /**
     * A node whose operands are being built; operands holds the fragments of the children finished so far.
     */
    private static final class Visit {
        final PatternNode node;
        final int start;
        final List<Fragment> operands = new ArrayList<>();

        Visit(final PatternNode node, final int start) {
            this.node = node;
            this.start = start;
        }
    }
}
