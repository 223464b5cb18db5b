package TMD.Machine;

import java.util.Objects;

public record Transition<I>(int nextState, I write, Direction direction) {

    public Transition {
        Objects.requireNonNull(write, "write");
        Objects.requireNonNull(direction, "direction");
    }

    @Override
    public String toString() {
        return "(" + nextState + ", " + write + ", " + direction.getLabel() + ")";
    }
}
