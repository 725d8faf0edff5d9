package io.paxbridge.rpc;

public enum RpcCode {
    // default json-rpc error codes
    ParseError(-32700, "Parse error"),
    InvalidRequest(-32600, "Invalid request"),
    MethodNotFound(-32601, "Method not found"),
    InvalidParams(-32602, "Invalid params"),
    InternalError(-32603, "Internal error"),

    // client side failures, never sent by a node
    TransportError(-1, "Transport error"),
    EmptyResult(-2, "Empty result");

    public final int code;
    public final String message;

    RpcCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
}
