package TMD.Machine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import TMD.Model.MachineAlphabet;

/**
 * Structural checks of a Turing machine against a machine alphabet. Does not run the machine.
 */
public class TMValidator {

    public static <I> boolean isValid(TuringMachine<I> tm, MachineAlphabet<I> expected) {
        return problems(tm, expected).isEmpty();
    }

    /**
     * @param tm - machine to check
     * @param expected - alphabet the machine must be written over
     * @return one message per problem found, empty for a well-formed machine
     */
    public static <I> List<String> problems(TuringMachine<I> tm, MachineAlphabet<I> expected) {
        final List<String> problems = new ArrayList<>();
        final List<I> tapeAlphabet = expected.tapeAlphabet();
        final int numStates = tm.getNumStates();

        if (tm.getStartState() < 0 || tm.getStartState() >= numStates) {
            problems.add("start state " + tm.getStartState() + " out of range");
        }
        if (!expected.isTapeSymbol(tm.getBlank())) {
            problems.add("blank symbol " + tm.getBlank() + " not in tape alphabet " + tapeAlphabet);
        }

        for (int state = 0; state < numStates; state++) {
            final Map<I, Transition<I>> row = tm.getTransitions(state);
            for (Map.Entry<I, Transition<I>> e : row.entrySet()) {
                final Transition<I> t = e.getValue();
                final String where = "δ(" + state + ", " + e.getKey() + ")";
                if (!expected.isTapeSymbol(e.getKey())) {
                    problems.add(where + " reads a symbol outside the tape alphabet");
                }
                if (!expected.isTapeSymbol(t.write())) {
                    problems.add(where + " writes " + t.write() + " outside the tape alphabet");
                }
                if (t.nextState() < 0 || t.nextState() > tm.getRejectState()) {
                    problems.add(where + " targets unknown state " + t.nextState());
                }
            }
            // totality
            for (I sym : tapeAlphabet) {
                if (!row.containsKey(sym)) {
                    problems.add("δ(" + state + ", " + sym + ") is undefined");
                }
            }
        }
        return problems;
    }
}
