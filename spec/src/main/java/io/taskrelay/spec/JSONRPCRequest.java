package io.taskrelay.spec;

import java.util.UUID;

import io.taskrelay.util.Assert;

/**
 * An outgoing JSON-RPC 2.0 request.
 *
 * @param jsonrpc always {@value #JSONRPC_VERSION}
 * @param id the request id
 * @param method the method name
 * @param params the method parameters
 * @param <P> the type of the parameters
 */
public record JSONRPCRequest<P>(String jsonrpc, Object id, String method, P params) {

    public static final String JSONRPC_VERSION = "2.0";
    public static final String SEND_MESSAGE_METHOD = "message/send";
    public static final String SEND_STREAMING_MESSAGE_METHOD = "message/stream";
    public static final String CANCEL_TASK_METHOD = "tasks/cancel";

    public JSONRPCRequest {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("params", params);
        Assert.isNullOrStringOrInteger(id);
        jsonrpc = JSONRPC_VERSION;
        id = id == null ? UUID.randomUUID().toString() : id;
    }

    public static <P> JSONRPCRequest<P> of(String method, P params) {
        return new JSONRPCRequest<>(JSONRPC_VERSION, UUID.randomUUID().toString(), method, params);
    }
}
