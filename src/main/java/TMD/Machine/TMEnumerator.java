package TMD.Machine;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;

import TMD.Model.MachineAlphabet;

/**
 * Every Turing machine over a machine alphabet, by increasing number of states, start state 0.
 * Each (state, tape symbol) pair gets a rule (next, write, move) with next in 0..n-1 or HALT, the accept sink.
 * Machines of the same size come in lexicographic order of their rules, the last (state, symbol) pair varying
 * fastest. The sequence is infinite; each call to iterator() starts again from the first machine.
 * @param <I> - Tape symbol type
 */
public class TMEnumerator<I> implements Iterable<TuringMachine<I>> {
    private static final Direction[] MOVES = {Direction.LEFT, Direction.RIGHT};

    private final MachineAlphabet<I> alphabet;

    public TMEnumerator(MachineAlphabet<I> alphabet) {
        this.alphabet = alphabet;
    }

    @Override
    public Iterator<TuringMachine<I>> iterator() {
        return new Cursor();
    }

    /**
     * @return number of machines with numStates states over tapeSymbols tape symbols
     */
    public static BigInteger machinesWithStates(int numStates, int tapeSymbols) {
        final long rules = (long) (numStates + 1) * tapeSymbols * MOVES.length;
        return BigInteger.valueOf(rules).pow(numStates * tapeSymbols);
    }

    private final class Cursor implements Iterator<TuringMachine<I>> {
        private final List<I> tapeAlphabet = alphabet.tapeAlphabet();
        private int numStates = 1;
        private int[] choices = new int[tapeAlphabet.size()];

        @Override
        public boolean hasNext() {
            return true;
        }

        @Override
        public TuringMachine<I> next() {
            final TuringMachine<I> tm = current();
            advance();
            return tm;
        }

        private TuringMachine<I> current() {
            final int symbols = tapeAlphabet.size();
            final TuringMachine.Builder<I> builder = TuringMachine.builder(numStates, 0, alphabet);
            for (int pos = 0; pos < choices.length; pos++) {
                final int rule = choices[pos];
                final int next = rule / (symbols * MOVES.length); // numStates encodes HALT
                final I write = tapeAlphabet.get((rule / MOVES.length) % symbols);
                final Direction move = MOVES[rule % MOVES.length];
                builder.addTransition(pos / symbols, tapeAlphabet.get(pos % symbols), next, write, move);
            }
            return builder.build();
        }

        private void advance() {
            final int rules = (numStates + 1) * tapeAlphabet.size() * MOVES.length;
            for (int pos = choices.length - 1; pos >= 0; pos--) {
                if (++choices[pos] < rules) {
                    return;
                }
                choices[pos] = 0;
            }
            // all machines of this size produced
            numStates++;
            choices = new int[numStates * tapeAlphabet.size()];
        }
    }
}
