package TMD.Machine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import TMD.Model.MachineAlphabet;

/**
 * Immutable single-tape Turing machine.
 * Non-sink states are 0..numStates-1; numStates is the accept sink and numStates+1 the reject sink.
 * Sinks have no transitions.
 * @param <I> - Tape symbol type
 */
public final class TuringMachine<I> {
    private final int numStates;
    private final int startState;
    private final MachineAlphabet<I> alphabet;
    private final List<Map<I, Transition<I>>> transitions;

    private TuringMachine(int numStates, int startState, MachineAlphabet<I> alphabet, List<Map<I, Transition<I>>> transitions) {
        this.numStates = numStates;
        this.startState = startState;
        this.alphabet = alphabet;
        List<Map<I, Transition<I>>> frozen = new ArrayList<>(transitions.size());
        for (Map<I, Transition<I>> row : transitions) {
            frozen.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.transitions = Collections.unmodifiableList(frozen);
    }

    public int getNumStates() {
        return numStates;
    }

    public int getStartState() {
        return startState;
    }

    public int getAcceptState() {
        return numStates;
    }

    public int getRejectState() {
        return numStates + 1;
    }

    public boolean isTerminal(int state) {
        return state == getAcceptState() || state == getRejectState();
    }

    public MachineAlphabet<I> getAlphabet() {
        return alphabet;
    }

    public I getBlank() {
        return alphabet.blank();
    }

    /**
     * @return the transition for (state, symbol), or null if the machine has none (always null for sinks)
     */
    public Transition<I> getTransition(int state, I symbol) {
        if (state < 0 || state >= numStates) {
            return null;
        }
        return transitions.get(state).get(symbol);
    }

    /**
     * @return the transitions leaving state, keyed by read symbol, in insertion order
     */
    public Map<I, Transition<I>> getTransitions(int state) {
        if (state < 0 || state >= numStates) {
            return Collections.emptyMap();
        }
        return transitions.get(state);
    }

    public int transitionCount() {
        int count = 0;
        for (Map<I, Transition<I>> row : transitions) {
            count += row.size();
        }
        return count;
    }

    public Builder<I> toBuilder() {
        final Builder<I> builder = new Builder<>(numStates, startState, alphabet);
        for (int state = 0; state < numStates; state++) {
            builder.transitions.get(state).putAll(transitions.get(state));
        }
        return builder;
    }

    public static <I> Builder<I> builder(int numStates, int startState, MachineAlphabet<I> alphabet) {
        return new Builder<>(numStates, startState, alphabet);
    }

    public static class Builder<I> {
        private final int numStates;
        private final int startState;
        private MachineAlphabet<I> alphabet;
        private final List<Map<I, Transition<I>>> transitions;

        private Builder(int numStates, int startState, MachineAlphabet<I> alphabet) {
            if (numStates <= 0) {
                throw new IllegalArgumentException("A Turing machine needs at least one non-sink state, got " + numStates);
            }
            if (startState < 0 || startState >= numStates) {
                throw new IllegalArgumentException("Start state " + startState + " is not one of the states 0.." + (numStates - 1));
            }
            this.numStates = numStates;
            this.startState = startState;
            this.alphabet = alphabet;
            this.transitions = new ArrayList<>(numStates);
            for (int i = 0; i < numStates; i++) {
                this.transitions.add(new LinkedHashMap<>());
            }
        }

        public int acceptState() {
            return numStates;
        }

        public int rejectState() {
            return numStates + 1;
        }

        public Builder<I> alphabet(MachineAlphabet<I> newAlphabet) {
            this.alphabet = newAlphabet;
            return this;
        }

        /**
         * Set δ(state, read) = (nextState, write, direction), replacing any earlier entry.
         */
        public Builder<I> addTransition(int state, I read, int nextState, I write, Direction direction) {
            if (state < 0 || state >= numStates) {
                throw new IllegalArgumentException("Transition source " + state + " is not a non-sink state");
            }
            if (nextState < 0 || nextState > rejectState()) {
                throw new IllegalArgumentException("Transition target " + nextState + " is not a state of the machine");
            }
            transitions.get(state).put(read, new Transition<>(nextState, write, direction));
            return this;
        }

        public Builder<I> removeTransition(int state, I read) {
            if (state >= 0 && state < numStates) {
                transitions.get(state).remove(read);
            }
            return this;
        }

        public TuringMachine<I> build() {
            return new TuringMachine<>(numStates, startState, alphabet, transitions);
        }
    }
}
