package io.paxbridge.issuer;

public final class ScanResult {

    public enum Status {
        // the target height was reached
        CAUGHT_UP,
        // the per call height budget ran out before the target
        CATCHING_UP,
        // a block or transaction fetch failed, the failed height is retried next call
        FETCH_FAILED,
        // the chain info could not be fetched at all
        CHAIN_UNAVAILABLE
    }

    private final int height;
    private final int targetHeight;
    private final long realtime;
    private final Status status;

    public ScanResult(int height, int targetHeight, long realtime, Status status) {
        this.height = height;
        this.targetHeight = targetHeight;
        this.realtime = realtime;
        this.status = status;
    }

    // Next height to scan
    public int height() {
        return height;
    }

    // Chain height reported by the node, 0 when unknown
    public int targetHeight() {
        return targetHeight;
    }

    // Epoch seconds when the scan caught up with the chain, 0 otherwise
    public long realtime() {
        return realtime;
    }

    public boolean isRealtime() {
        return realtime != 0;
    }

    public Status status() {
        return status;
    }

    @Override
    public String toString() {
        return String.format("ScanResult{height=%d, target=%d, realtime=%d, status=%s}", height, targetHeight, realtime, status);
    }
}
