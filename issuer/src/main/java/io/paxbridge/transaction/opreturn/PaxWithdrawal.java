package io.paxbridge.transaction.opreturn;

import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.ScriptUtils;

/**
 * 'W' tagged OP_RETURN payload: the tag, a {@link PaxPubkey} and the 4 bytes little endian
 * height of the fiat chain the request refers to.
 */
public final class PaxWithdrawal {
    public static final int PAYLOAD_LENGTH = 1 + PaxPubkey.LENGTH + 4;

    private final PaxPubkey pubkey;
    private final int height;

    public PaxWithdrawal(PaxPubkey pubkey, int height) {
        this.pubkey = pubkey;
        this.height = height;
    }

    public PaxPubkey pubkey() {
        return pubkey;
    }

    public int height() {
        return height;
    }

    // Parses the payload starting at the tag byte
    public static PaxWithdrawal parse(byte[] script, int tagOffset) {
        if (tagOffset < 0 || script.length < tagOffset + PAYLOAD_LENGTH)
            throw new IllegalArgumentException("PaxWithdrawal: payload is out of script bounds");
        if (script[tagOffset] != OpReturnData.TAG_WITHDRAW)
            throw new IllegalArgumentException(String.format("PaxWithdrawal: unexpected tag 0x%02x", script[tagOffset]));

        int offset = tagOffset + 1;
        PaxPubkey pubkey = PaxPubkey.parse(script, offset);
        offset += PaxPubkey.LENGTH;
        int height = BytesUtils.getReversedInt(script, offset);
        return new PaxWithdrawal(pubkey, height);
    }

    // Full OP_RETURN script carrying this withdrawal
    public byte[] toScript() {
        byte[] push = PushDataLength.toBytes(PAYLOAD_LENGTH);
        byte[] script = new byte[1 + push.length + PAYLOAD_LENGTH];
        int offset = 0;
        script[offset++] = ScriptUtils.OP_RETURN;
        System.arraycopy(push, 0, script, offset, push.length);
        offset += push.length;
        script[offset++] = OpReturnData.TAG_WITHDRAW;
        System.arraycopy(pubkey.bytes(), 0, script, offset, PaxPubkey.LENGTH);
        offset += PaxPubkey.LENGTH;
        BytesUtils.putReversedInt(script, offset, height);
        return script;
    }

    @Override
    public String toString() {
        return String.format("PaxWithdrawal {\nheight = %d\npubkey = %s\n}", height, pubkey);
    }
}
