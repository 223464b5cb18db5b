package TMD.Model;

import java.util.BitSet;

import TMD.EpsilonClosure;
import TMD.SubsetMove;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * A {@link CompactNFA} that additionally carries epsilon moves.
 * Epsilon moves live in their own relation, so the epsilon pseudo-symbol is never part of the input alphabet.
 * @param <I> - Input symbol type, e.g., String
 */
public class EpsilonNFA<I> extends CompactNFA<I> {
    /** Label used when epsilon moves are written out or read from BA files. */
    public static final String EPSILON = "eps";

    private final Int2ObjectMap<IntSortedSet> epsilonTransitions = new Int2ObjectOpenHashMap<>();

    public EpsilonNFA(Alphabet<I> alphabet, int stateCapacity) {
        super(alphabet, stateCapacity);
    }

    public EpsilonNFA(Alphabet<I> alphabet) {
        super(alphabet);
    }

    public void addEpsilonTransition(int source, int target) {
        checkState(source);
        checkState(target);
        IntSortedSet targets = epsilonTransitions.get(source);
        if (targets == null) {
            targets = new IntRBTreeSet();
            epsilonTransitions.put(source, targets);
        }
        targets.add(target);
    }

    /**
     * @param state - source state
     * @return states reachable from state by one epsilon move, in ascending order
     */
    public IntSortedSet getEpsilonTransitions(int state) {
        final IntSortedSet targets = epsilonTransitions.get(state);
        return targets == null ? IntSortedSets.EMPTY_SET : IntSortedSets.unmodifiable(targets);
    }

    public boolean hasEpsilonTransitions() {
        return !epsilonTransitions.isEmpty();
    }

    /**
     * Epsilon-aware acceptance: closure, then move and closure per symbol.
     */
    @Override
    public boolean accepts(Iterable<? extends I> input) {
        if (getInitialStates().isEmpty()) {
            return false;
        }
        BitSet current = new BitSet();
        for (int init : getInitialStates()) {
            current.set(init);
        }
        current = EpsilonClosure.closure(this, current);
        for (I sym : input) {
            current = EpsilonClosure.closure(this, SubsetMove.move(this, current, sym));
            if (current.isEmpty()) {
                return false;
            }
        }
        for (int s = current.nextSetBit(0); s >= 0; s = current.nextSetBit(s + 1)) {
            if (isAccepting(s)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void clear() {
        super.clear();
        epsilonTransitions.clear();
    }

    private void checkState(int state) {
        if (state < 0 || state >= size()) {
            throw new IllegalArgumentException("State " + state + " is not a state of this automaton (size " + size() + ")");
        }
    }

    /**
     * Copy an epsilon-free NFA over integer states into an EpsilonNFA, preserving state ids.
     * @param nfa - source NFA, states 0..size-1
     * @param alphabet - input alphabet of the source
     * @return copy without epsilon moves
     * @param <I> - Input symbol type
     */
    public static <I> EpsilonNFA<I> copyOf(NFA<Integer, I> nfa, Alphabet<I> alphabet) {
        final int size = nfa.size();
        final EpsilonNFA<I> out = new EpsilonNFA<>(alphabet, size);
        for (int i = 0; i < size; i++) {
            out.addState(nfa.isAccepting(i));
        }
        for (int init : nfa.getInitialStates()) {
            out.setInitial(init, true);
        }
        for (int q = 0; q < size; q++) {
            for (I a : alphabet) {
                out.addTransitions(q, a, nfa.getTransitions(q, a));
            }
        }
        return out;
    }
}
