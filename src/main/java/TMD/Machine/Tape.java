package TMD.Machine;

import java.util.ArrayList;
import java.util.List;

/**
 * Tape that is blank in both directions; cells are materialized only when the head reaches them.
 */
public class Tape<I> {
    private final List<I> cells;
    private final I blank;

    public Tape(List<? extends I> input, I blank) {
        this.cells = new ArrayList<>(input.size() + 1);
        this.cells.addAll(input);
        this.cells.add(blank);
        this.blank = blank;
    }

    /**
     * Pad with blanks until head is a materialized cell.
     * @param head - head position, possibly outside the current cells
     * @return the same cell's index after padding; shifted right when blanks were added on the left
     */
    public int ensureCell(int head) {
        while (head < 0) {
            cells.add(0, blank);
            head++;
        }
        while (head >= cells.size()) {
            cells.add(blank);
        }
        return head;
    }

    public I read(int head) {
        return cells.get(head);
    }

    public void write(int head, I symbol) {
        cells.set(head, symbol);
    }

    public int size() {
        return cells.size();
    }

    public List<I> snapshot() {
        return List.copyOf(cells);
    }
}
