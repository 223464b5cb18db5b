package TMD;

import TMD.Machine.Direction;
import TMD.Machine.TuringMachine;
import TMD.Model.MachineAlphabet;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.concept.InputAlphabetHolder;
import net.automatalib.automaton.fsa.DFA;

public class TMDeciderBuilder {
    public static <I, A extends DFA<Integer, I> & InputAlphabetHolder<I>> TuringMachine<I> toTMDecider(A dfa, I blank) {
        return toTMDecider(dfa, new MachineAlphabet<>(dfa.getInputAlphabet(), blank));
    }

    /**
     * Turn a DFA into a Turing machine that decides the same language.
     * The machine keeps the DFA's states, scans the input left to right without changing it, and on the blank
     * after the input moves to the accept sink iff the DFA state is accepting.
     * Missing DFA transitions, and input symbols the DFA does not know, lead to the reject sink.
     * @param dfa - DFA with states 0..size-1 and an initial state
     * @param alphabet - input alphabet the machine reads (normally the DFA's own) and the blank
     * @return machine whose transition function is total over states 0..size-1 and the tape alphabet
     * @param <I> - Input symbol type
     */
    public static <I, A extends DFA<Integer, I> & InputAlphabetHolder<I>> TuringMachine<I> toTMDecider(
        A dfa, MachineAlphabet<I> alphabet) {
        final Integer start = dfa.getInitialState();
        if (start == null) {
            throw new IllegalArgumentException("DFA has no initial state");
        }
        final int numStates = dfa.size();
        for (Integer state : dfa.getStates()) {
            if (state < 0 || state >= numStates) {
                throw new IllegalArgumentException("DFA state ids must be 0.." + (numStates - 1) + ", found " + state);
            }
        }
        final Alphabet<I> dfaAlphabet = dfa.getInputAlphabet();
        final I blank = alphabet.blank();
        if (dfaAlphabet.containsSymbol(blank)) {
            throw new IllegalArgumentException("Blank symbol " + blank + " is a DFA input symbol");
        }

        final TuringMachine.Builder<I> builder = TuringMachine.builder(numStates, start, alphabet);
        final int accept = builder.acceptState();
        final int reject = builder.rejectState();

        for (int state = 0; state < numStates; state++) {
            for (I sym : alphabet.inputAlphabet()) {
                Integer target = null;
                if (dfaAlphabet.containsSymbol(sym)) {
                    target = dfa.getTransition(state, sym);
                }
                builder.addTransition(state, sym, target == null ? reject : target, sym, Direction.RIGHT);
            }
            // end of input; the direction is irrelevant for the sinks but keeps the table total
            final int end = dfa.isAccepting(state) ? accept : reject;
            builder.addTransition(state, blank, end, blank, Direction.RIGHT);
        }
        return builder.build();
    }
}
