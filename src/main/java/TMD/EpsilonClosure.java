package TMD;

import java.util.BitSet;

import TMD.Model.EpsilonNFA;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;

public class EpsilonClosure {
    /**
     * Closure of a state set under epsilon moves.
     * @param nfa - automaton providing the epsilon moves
     * @param states - states to close; not modified
     * @return new set holding states and everything epsilon-reachable from them
     */
    public static BitSet closure(EpsilonNFA<?> nfa, BitSet states) {
        final BitSet result = (BitSet) states.clone();
        final IntArrayList worklist = new IntArrayList(states.cardinality());
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            worklist.push(s);
        }

        while (!worklist.isEmpty()) {
            final int state = worklist.popInt();
            final IntIterator it = nfa.getEpsilonTransitions(state).iterator();
            while (it.hasNext()) {
                final int next = it.nextInt();
                // each state enters the worklist at most once
                if (!result.get(next)) {
                    result.set(next);
                    worklist.push(next);
                }
            }
        }
        return result;
    }

    public static BitSet closure(EpsilonNFA<?> nfa, int state) {
        final BitSet single = new BitSet();
        single.set(state);
        return closure(nfa, single);
    }
}
