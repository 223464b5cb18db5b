package TMD;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

import TMD.Model.EpsilonNFA;
import TMD.Model.SubsetConstruction;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.MutableDFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

public class Determinizer {
    public static boolean DEBUG = false;
    public static final int MISSING_SUBSET = -1;
    private static final int SUBSETS_EXPLORED_PERIOD = 1000;

    public static <I> CompactDFA<I> determinize(EpsilonNFA<I> nfa) {
        return construct(nfa).dfa();
    }

    /**
     * Subset construction with epsilon closures.
     * The subset list doubles as worklist and index table: subset i is DFA state i,
     * and subsets are processed strictly in discovery order.
     * @param nfa - NFA with exactly one initial state
     * @return DFA over the NFA's alphabet, plus the subset behind every DFA state
     * @param <I> - Input symbol type
     */
    public static <I> SubsetConstruction<I> construct(EpsilonNFA<I> nfa) {
        final int start = startState(nfa);
        final Alphabet<I> alphabet = nfa.getInputAlphabet();

        final CompactDFA<I> dfa = new CompactDFA<>(alphabet);
        final MutableDFA<Integer, I> out = dfa;
        final List<BitSet> subsets = new ArrayList<>();
        final Object2IntMap<BitSet> subsetIndex = new Object2IntOpenHashMap<>();
        subsetIndex.defaultReturnValue(MISSING_SUBSET);

        final BitSet init = EpsilonClosure.closure(nfa, start);
        subsetIndex.put(init, subsets.size());
        subsets.add(init);
        out.addInitialState(isAccepting(nfa, init));

        for (int index = 0; index < subsets.size(); index++) {
            final BitSet subset = subsets.get(index);
            for (I sym : alphabet) {
                final BitSet moved = SubsetMove.move(nfa, subset, sym);
                // the empty set is closed already; it becomes the dead state
                final BitSet target = moved.isEmpty() ? moved : EpsilonClosure.closure(nfa, moved);

                int targetIndex = subsetIndex.getInt(target);
                if (targetIndex == MISSING_SUBSET) {
                    targetIndex = subsets.size();
                    subsetIndex.put(target, targetIndex);
                    subsets.add(target);
                    out.addState(isAccepting(nfa, target));
                }
                out.setTransition(index, sym, targetIndex);
            }

            if (DEBUG && (index + 1) % SUBSETS_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + (index + 1) + " subsets - "
                    + (subsets.size() - index - 1) + " subsets left in queue");
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Subset construction finished with " + subsets.size() + " DFA states");
        }
        return new SubsetConstruction<>(dfa, subsets);
    }

    private static int startState(EpsilonNFA<?> nfa) {
        final Set<Integer> inits = nfa.getInitialStates();
        if (inits.size() != 1) {
            throw new IllegalArgumentException("NFA must have exactly one start state, found " + inits.size());
        }
        return inits.iterator().next();
    }

    private static boolean isAccepting(EpsilonNFA<?> nfa, BitSet subset) {
        for (int s = subset.nextSetBit(0); s >= 0; s = subset.nextSetBit(s + 1)) {
            if (nfa.isAccepting(s)) {
                return true;
            }
        }
        return false;
    }
}
