package io.paxbridge.transaction.opreturn;

import io.paxbridge.utils.ScriptUtils;

import java.util.Optional;

// Header of an OP_RETURN script: the opcode, the push-data length and the tag byte that follows it.
public final class OpReturnData {
    public static final byte TAG_WITHDRAW = 'W';
    public static final byte TAG_ISSUED = 'X';

    private final PushDataLength pushLength;
    private final int tagOffset;
    private final byte tag;

    private OpReturnData(PushDataLength pushLength, int tagOffset, byte tag) {
        this.pushLength = pushLength;
        this.tagOffset = tagOffset;
        this.tag = tag;
    }

    /**
     * @return empty when the script is not an OP_RETURN script
     * @throws IllegalArgumentException when the push prefix or the tag byte lie outside the script
     */
    public static Optional<OpReturnData> parse(byte[] script) {
        if (!ScriptUtils.isOpReturn(script))
            return Optional.empty();
        int offset = 1;
        PushDataLength pushLength = PushDataLength.read(script, offset);
        offset += pushLength.size();
        if (script.length <= offset)
            throw new IllegalArgumentException("OpReturnData: tag byte is out of script bounds");
        return Optional.of(new OpReturnData(pushLength, offset, script[offset]));
    }

    // Declared number of pushed bytes, tag included
    public int payloadLength() {
        return pushLength.value();
    }

    public PushDataLength pushLength() {
        return pushLength;
    }

    public int tagOffset() {
        return tagOffset;
    }

    public byte tag() {
        return tag;
    }

    @Override
    public String toString() {
        return String.format("OpReturnData{tag='%c', payloadLength=%d, tagOffset=%d}", (char) tag, payloadLength(), tagOffset);
    }
}
