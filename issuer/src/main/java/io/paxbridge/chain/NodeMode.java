package io.paxbridge.chain;

// How a coin is reached: only through a remote node's RPC, or through a node embedded in the process.
public enum NodeMode {
    RemoteOnly,
    EmbeddedFull,
    EmbeddedValidating;

    public boolean isEmbedded() {
        return this != RemoteOnly;
    }

    public static NodeMode fromString(String value) {
        for (NodeMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value))
                return mode;
        }
        throw new IllegalArgumentException("Unknown node mode: " + value);
    }
}
