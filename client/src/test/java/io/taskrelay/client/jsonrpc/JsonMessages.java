package io.taskrelay.client.jsonrpc;

/**
 * Canned target agent responses.
 */
final class JsonMessages {

    private JsonMessages() {
    }

    static String sse(String... results) {
        StringBuilder sb = new StringBuilder();
        for (String result : results) {
            sb.append("data: ").append(result.replace("\n", "")).append("\n\n");
        }
        return sb.toString();
    }

    static final String STATUS_WORKING_STEP_1 = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "status-update", "taskId": "remote-1", "contextId": "c-1", "final": false,
              "status": {"state": "working", "message": {"role": "agent", "messageId": "m-1", "kind": "message",
                "parts": [{"kind": "text", "text": "step 1"}]}}}}""";

    static final String STATUS_WORKING_STEP_2 = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "status-update", "taskId": "remote-1", "contextId": "c-1", "final": false,
              "status": {"state": "working", "message": {"role": "agent", "messageId": "m-2", "kind": "message",
                "parts": [{"kind": "text", "text": "step 2"}]}}}}""";

    static final String STATUS_COMPLETED = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "status-update", "taskId": "remote-1", "contextId": "c-1", "final": true,
              "status": {"state": "completed", "message": {"role": "agent", "messageId": "m-3", "kind": "message",
                "parts": [{"kind": "text", "text": "all done"}]}}}}""";

    static final String SEND_RESULT_COMPLETED = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "task", "id": "remote-1", "contextId": "c-1",
              "status": {"state": "completed"},
              "history": [
                {"role": "user", "messageId": "u-1", "kind": "message", "parts": [{"kind": "text", "text": "plan my trip"}]},
                {"role": "agent", "messageId": "a-1", "kind": "message", "parts": [{"kind": "text", "text": "Here is your itinerary"}]}
              ]}}""";

    static final String SEND_RESULT_WORKING = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "task", "id": "remote-1", "contextId": "c-1", "status": {"state": "working"}}}""";

    static final String SEND_RESULT_SUBMITTED = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "task", "id": "remote-1", "contextId": "c-1",
              "status": {"state": "submitted", "message": {"role": "agent", "messageId": "a-1", "kind": "message",
                "parts": [{"kind": "text", "text": "Got it, working on it"}]}}}}""";

    static final String SEND_RESULT_FAILED = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "task", "id": "remote-1", "contextId": "c-1",
              "status": {"state": "failed", "message": {"role": "agent", "messageId": "a-1", "kind": "message",
                "parts": [{"kind": "text", "text": "quota exhausted"}]}}}}""";

    static final String CANCEL_RESULT = """
            {"jsonrpc": "2.0", "id": "1", "result": {
              "kind": "task", "id": "remote-1", "status": {"state": "canceled"}}}""";

    static final String METHOD_NOT_FOUND = """
            {"jsonrpc": "2.0", "id": "1", "error": {"code": -32601, "message": "Method not found"}}""";

    static final String PUSH_NOT_SUPPORTED = """
            {"jsonrpc": "2.0", "id": "1", "error": {"code": -32003, "message": "Push Notification is not supported"}}""";

    static final String NOT_CANCELABLE = """
            {"jsonrpc": "2.0", "id": "1", "error": {"code": -32002, "message": "Task cannot be canceled"}}""";

    static final String AGENT_CARD = """
            {"name": "planner", "url": "http://localhost/a2a", "version": "1.0.0",
             "capabilities": {"streaming": false, "pushNotifications": true}}""";
}
