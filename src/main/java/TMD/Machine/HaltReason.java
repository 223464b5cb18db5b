package TMD.Machine;

/**
 * Why a simulation stopped. Only ACCEPT_STATE yields an accepting verdict.
 */
public enum HaltReason {
    ACCEPT_STATE(Verdict.ACCEPT),
    REJECT_STATE(Verdict.REJECT),
    // step budget used up
    STEP_LIMIT(Verdict.REJECT),
    // no entry for (state, symbol) in the transition table
    UNDEFINED_TRANSITION(Verdict.REJECT);

    private final Verdict verdict;

    HaltReason(Verdict verdict) {
        this.verdict = verdict;
    }

    public Verdict getVerdict() {
        return verdict;
    }
}
