package io.paxbridge.oracle;

import io.paxbridge.transaction.opreturn.PaxPubkey;
import io.paxbridge.utils.BytesUtils;

import java.util.Optional;

public final class FiatDestination {
    static final FiatDestination NONE = new FiatDestination(0, null, null);

    private final long peggedAmount;
    private final PaxPubkey pubkey;
    private final String destAddress;

    FiatDestination(long peggedAmount, PaxPubkey pubkey, String destAddress) {
        this.peggedAmount = peggedAmount;
        this.pubkey = pubkey;
        this.destAddress = destAddress;
    }

    // Oracle equivalent in the pegged unit, 0 when unknown or not applicable
    public long peggedAmount() {
        return peggedAmount;
    }

    // Empty when the source address could not be decoded
    public Optional<PaxPubkey> pubkey() {
        return Optional.ofNullable(pubkey);
    }

    public Optional<String> destAddress() {
        return Optional.ofNullable(destAddress);
    }

    @Override
    public String toString() {
        return String.format("FiatDestination{peggedAmount=%d, pubkey=%s, destAddress=%s}", peggedAmount,
                pubkey == null ? null : BytesUtils.toHexString(pubkey.bytes()), destAddress);
    }
}
