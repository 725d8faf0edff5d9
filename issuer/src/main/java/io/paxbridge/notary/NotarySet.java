package io.paxbridge.notary;

import io.paxbridge.utils.BytesUtils;
import io.paxbridge.utils.ScriptUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

// Ordered compressed public keys of the notaries active at a height.
public final class NotarySet {
    public static final int MAX_NOTARIES = 64;

    private final int height;
    private final List<byte[]> pubkeys;

    public NotarySet(int height, List<byte[]> pubkeys) {
        if (pubkeys.size() > MAX_NOTARIES)
            throw new IllegalArgumentException(String.format("At most %d notaries, got %d", MAX_NOTARIES, pubkeys.size()));
        List<byte[]> copy = new ArrayList<>(pubkeys.size());
        for (byte[] pubkey : pubkeys) {
            if (pubkey.length != ScriptUtils.COMPRESSED_PUBKEY_LENGTH)
                throw new IllegalArgumentException("Notary pubkey must be 33 bytes long");
            copy.add(Arrays.copyOf(pubkey, pubkey.length));
        }
        this.height = height;
        this.pubkeys = Collections.unmodifiableList(copy);
    }

    public int height() {
        return height;
    }

    public int size() {
        return pubkeys.size();
    }

    public byte[] pubkey(int index) {
        byte[] pubkey = pubkeys.get(index);
        return Arrays.copyOf(pubkey, pubkey.length);
    }

    public int indexOf(byte[] pubkey) {
        for (int i = 0; i < pubkeys.size(); i++) {
            if (Arrays.equals(pubkeys.get(i), pubkey))
                return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NotarySet{height=").append(height).append(", pubkeys=[");
        for (int i = 0; i < pubkeys.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(BytesUtils.toHexString(pubkeys.get(i)));
        }
        return sb.append("]}").toString();
    }
}
