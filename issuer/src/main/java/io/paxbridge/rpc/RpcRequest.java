package io.paxbridge.rpc;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {"jsonrpc":"1.0","id":7,"method":"getblockhash","params":[1200]}
 */
public class RpcRequest {
    private static final String JSON_RPC_VERSION = "1.0";

    @JsonProperty("jsonrpc")
    public final String jsonrpc = JSON_RPC_VERSION;
    @JsonProperty("id")
    public final long id;
    @JsonProperty("method")
    public final String method;
    @JsonProperty("params")
    public final List<Object> params;

    public RpcRequest(long id, String method, List<Object> params) {
        this.id = id;
        this.method = method;
        this.params = params == null ? List.of() : params;
    }

    @Override
    public String toString() {
        return String.format("RpcRequest={jsonrpc='%s', id='%d', method='%s', params=%s}", jsonrpc, id, method, params);
    }
}
