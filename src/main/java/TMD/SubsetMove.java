package TMD;

import java.util.BitSet;

import TMD.Model.EpsilonNFA;

public class SubsetMove {
    /**
     * Union of the direct successors on symbol of every state in the set. Epsilon moves are not followed.
     * @param nfa - automaton
     * @param states - source states
     * @param symbol - input symbol; a symbol outside the alphabet has no successors
     * @return new, possibly empty, successor set
     */
    public static <I> BitSet move(EpsilonNFA<I> nfa, BitSet states, I symbol) {
        final BitSet result = new BitSet();
        if (!nfa.getInputAlphabet().containsSymbol(symbol)) {
            return result;
        }
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            for (Integer t : nfa.getTransitions(s, symbol)) {
                result.set(t);
            }
        }
        return result;
    }
}
