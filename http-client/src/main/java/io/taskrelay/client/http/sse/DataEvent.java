package io.taskrelay.client.http.sse;

public class DataEvent extends Event {

    private final String name;
    private final String data;
    private final String id;

    public DataEvent(String name, String data, String id) {
        this.name = name;
        this.data = data;
        this.id = id;
    }

    @Override
    public Type getType() {
        return Type.DATA;
    }

    public String getName() {
        return name;
    }

    public String getData() {
        return data;
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "DataEvent{name='" + name + "', id='" + id + "', data='" + data + "'}";
    }
}
