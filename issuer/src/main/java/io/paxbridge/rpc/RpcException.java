package io.paxbridge.rpc;

public class RpcException extends Exception {
    public final RpcError error;

    public RpcException(RpcError error) {
        super(error.toString());
        this.error = error;
    }

    public RpcException(RpcError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }
}
