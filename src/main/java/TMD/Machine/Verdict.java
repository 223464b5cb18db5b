package TMD.Machine;

public enum Verdict {
    ACCEPT,
    REJECT;

    /** 1 for accept, 0 for reject. */
    public int asBit() {
        return this == ACCEPT ? 1 : 0;
    }
}
