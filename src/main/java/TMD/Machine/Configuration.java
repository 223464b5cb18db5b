package TMD.Machine;

import java.util.List;

/**
 * Snapshot of one simulation step. The head is an index into tape and may be -1 or tape.size()
 * when the previous move left the materialized part of the tape.
 */
public record Configuration<I>(int state, List<I> tape, int head) {

    public Configuration {
        tape = List.copyOf(tape);
    }

    public String tapeString() {
        final StringBuilder sb = new StringBuilder();
        for (I cell : tape) {
            sb.append(cell);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "state=" + state + ", tape=" + tapeString() + ", head pos=" + head;
    }
}
