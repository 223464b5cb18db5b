package TMD.Machine;

import java.util.List;

/**
 * Verdict of a simulation together with every configuration visited, the halting one included.
 * @param steps - number of transitions applied
 */
public record SimulationResult<I>(Verdict verdict, HaltReason reason, List<Configuration<I>> trace, int steps) {

    public SimulationResult {
        trace = List.copyOf(trace);
    }

    public boolean accepted() {
        return verdict == Verdict.ACCEPT;
    }

    public Configuration<I> finalConfiguration() {
        return trace.get(trace.size() - 1);
    }
}
