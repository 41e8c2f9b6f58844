package io.taskrelay.client.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.spec.JSONRPCError;
import io.taskrelay.spec.ProtocolRejectionException;
import io.taskrelay.util.Utils;

final class JSONRPCResponses {

    private JSONRPCResponses() {
    }

    /**
     * Returns the {@code result} member of a JSON-RPC response.
     *
     * @throws ProtocolRejectionException if the response carries an {@code error} or no result
     * @throws JsonProcessingException if the body is not JSON
     */
    static JsonNode result(String body) throws JsonProcessingException {
        return result(Utils.OBJECT_MAPPER.readTree(body));
    }

    static JsonNode result(JsonNode response) throws JsonProcessingException {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new ProtocolRejectionException(Utils.OBJECT_MAPPER.treeToValue(error, JSONRPCError.class));
        }
        JsonNode result = response.get("result");
        if (result == null || result.isNull()) {
            throw new ProtocolRejectionException("JSON-RPC response has neither result nor error");
        }
        return result;
    }
}
