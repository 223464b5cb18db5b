package TMD.Model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Output of subset construction: the DFA together with the NFA subset behind each DFA state.
 * DFA state i corresponds to subsets.get(i).
 */
public record SubsetConstruction<I>(CompactDFA<I> dfa, List<BitSet> subsets) {

    public SubsetConstruction {
        final List<BitSet> copies = new ArrayList<>(subsets.size());
        for (BitSet subset : subsets) {
            copies.add((BitSet) subset.clone());
        }
        subsets = List.copyOf(copies);
    }

    /**
     * @return copies of the NFA subsets, indexed by DFA state
     */
    @Override
    public List<BitSet> subsets() {
        final List<BitSet> copies = new ArrayList<>(subsets.size());
        for (BitSet subset : subsets) {
            copies.add((BitSet) subset.clone());
        }
        return copies;
    }

    /**
     * @param dfaState - state of the DFA
     * @return copy of the NFA states the DFA state stands for
     */
    public BitSet subsetOf(int dfaState) {
        return (BitSet) subsets.get(dfaState).clone();
    }

    /**
     * @return index of the empty subset (dead state), or -1 if every subset is non-empty
     */
    public int deadState() {
        for (int i = 0; i < subsets.size(); i++) {
            if (subsets.get(i).isEmpty()) {
                return i;
            }
        }
        return -1;
    }
}
