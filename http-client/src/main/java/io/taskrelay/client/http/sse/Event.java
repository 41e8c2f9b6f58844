package io.taskrelay.client.http.sse;

/**
 * One server-sent event. Target agents put JSON-RPC responses in {@link DataEvent}s; comments
 * are keep-alives and carry nothing the forwarding client reads.
 */
public abstract class Event {

    public enum Type {
        COMMENT,
        DATA,
    }

    public abstract Type getType();

    public boolean isData() {
        return getType() == Type.DATA;
    }
}
