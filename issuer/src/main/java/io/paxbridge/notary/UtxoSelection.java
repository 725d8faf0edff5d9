package io.paxbridge.notary;

import java.util.Optional;

public final class UtxoSelection {
    static final UtxoSelection NONE = new UtxoSelection(0, null);

    private final int count;
    private final FundingCandidate selected;

    UtxoSelection(int count, FundingCandidate selected) {
        this.count = count;
        this.selected = selected;
    }

    // Number of eligible outputs found at the address
    public int count() {
        return count;
    }

    public Optional<FundingCandidate> selected() {
        return Optional.ofNullable(selected);
    }

    @Override
    public String toString() {
        return String.format("UtxoSelection{count=%d, selected=%s}", count, selected);
    }
}
