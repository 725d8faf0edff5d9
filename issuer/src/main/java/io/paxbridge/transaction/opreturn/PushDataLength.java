package io.paxbridge.transaction.opreturn;

// Script push-data length prefix: a single length byte below OP_PUSHDATA1,
// OP_PUSHDATA1 followed by one length byte, or OP_PUSHDATA2 followed by two length bytes
// combined as (first << 8) | second. Actual prefix size is 1, 2 or 3 bytes.
public final class PushDataLength {
    public static final int OP_PUSHDATA1 = 0x4c;
    public static final int OP_PUSHDATA2 = 0x4d;
    public static final int MAX_LENGTH = 0xFFFF;

    private final int value;
    private final int size;

    public PushDataLength(int value, int size) {
        this.value = value;
        this.size = size;
    }

    // Number of data bytes that follow the prefix
    public int value() {
        return value;
    }

    // Number of prefix bytes consumed
    public int size() {
        return size;
    }

    public static int getSize(int length) {
        if (length < 0 || length > MAX_LENGTH)
            throw new IllegalArgumentException("Push data length out of range: " + length);
        if (length < OP_PUSHDATA1)
            return 1;
        if (length <= 0xFF)
            return 2;
        return 3;
    }

    public static PushDataLength read(byte[] script, int offset) {
        if (offset < 0 || script.length < offset + 1)
            throw new IllegalArgumentException("PushDataLength: Value is out of array bounds");

        int first = script[offset] & 0xFF;
        if (first == OP_PUSHDATA1) {
            if (script.length < offset + 2)
                throw new IllegalArgumentException("PushDataLength: medium push is truncated");
            return new PushDataLength(script[offset + 1] & 0xFF, 2);
        }
        if (first == OP_PUSHDATA2) {
            if (script.length < offset + 3)
                throw new IllegalArgumentException("PushDataLength: large push is truncated");
            int value = ((script[offset + 1] & 0xFF) << 8) | (script[offset + 2] & 0xFF);
            return new PushDataLength(value, 3);
        }
        // any other byte, including the remaining push opcodes, is taken as the length itself
        return new PushDataLength(first, 1);
    }

    public static byte[] toBytes(int length) {
        int size = getSize(length);
        byte[] res = new byte[size];
        switch (size) {
            case 1:
                res[0] = (byte) length;
                break;

            case 2:
                res[0] = (byte) OP_PUSHDATA1;
                res[1] = (byte) length;
                break;

            default:
                res[0] = (byte) OP_PUSHDATA2;
                res[1] = (byte) ((length >> 8) & 0xFF);
                res[2] = (byte) (length & 0xFF);
        }
        return res;
    }

    @Override
    public String toString() {
        return String.format("PushDataLength{value=%d, size=%d}", value, size);
    }
}
