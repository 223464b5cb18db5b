package TMD.Machine;

public enum Direction {
    LEFT('L', -1),
    RIGHT('R', 1);

    private final char label;
    private final int offset;

    Direction(char label, int offset) {
        this.label = label;
        this.offset = offset;
    }

    public char getLabel() {
        return label;
    }

    /** Head displacement of one move. */
    public int getOffset() {
        return offset;
    }
}
