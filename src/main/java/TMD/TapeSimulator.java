package TMD;

import java.util.ArrayList;
import java.util.List;

import TMD.Machine.Configuration;
import TMD.Machine.HaltReason;
import TMD.Machine.SimulationResult;
import TMD.Machine.Tape;
import TMD.Machine.Transition;
import TMD.Machine.TuringMachine;

public class TapeSimulator {
    public static final int NO_STEP_LIMIT = -1;

    public static <I> SimulationResult<I> simulate(TuringMachine<I> tm, List<? extends I> input) {
        return simulate(tm, input, NO_STEP_LIMIT);
    }

    /**
     * Run tm on input, recording the configuration before every step and the halting configuration.
     * The tape starts as input followed by one blank, with the head on the first cell.
     * @param tm - machine to run
     * @param input - input symbols
     * @param maxSteps - maximal number of transitions to apply; negative for no limit
     * @return ACCEPT only if the accept sink is reached. The reject sink, an exhausted step budget and
     *      a missing transition all give REJECT, with the trace collected so far.
     * @param <I> - Tape symbol type
     */
    public static <I> SimulationResult<I> simulate(TuringMachine<I> tm, List<? extends I> input, int maxSteps) {
        final Tape<I> tape = new Tape<>(input, tm.getBlank());
        final List<Configuration<I>> trace = new ArrayList<>();
        int head = 0;
        int state = tm.getStartState();
        int steps = 0;

        while (true) {
            trace.add(new Configuration<>(state, tape.snapshot(), head));

            if (state == tm.getAcceptState()) {
                return new SimulationResult<>(HaltReason.ACCEPT_STATE.getVerdict(), HaltReason.ACCEPT_STATE, trace, steps);
            }
            if (state == tm.getRejectState()) {
                return new SimulationResult<>(HaltReason.REJECT_STATE.getVerdict(), HaltReason.REJECT_STATE, trace, steps);
            }
            if (maxSteps >= 0 && steps >= maxSteps) {
                return new SimulationResult<>(HaltReason.STEP_LIMIT.getVerdict(), HaltReason.STEP_LIMIT, trace, steps);
            }

            head = tape.ensureCell(head);
            final Transition<I> transition = tm.getTransition(state, tape.read(head));
            if (transition == null) {
                return new SimulationResult<>(
                    HaltReason.UNDEFINED_TRANSITION.getVerdict(), HaltReason.UNDEFINED_TRANSITION, trace, steps);
            }

            tape.write(head, transition.write());
            head += transition.direction().getOffset();
            state = transition.nextState();
            steps++;
        }
    }
}
