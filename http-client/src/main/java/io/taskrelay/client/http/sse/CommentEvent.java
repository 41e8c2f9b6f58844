package io.taskrelay.client.http.sse;

public class CommentEvent extends Event {

    private final String comment;

    public CommentEvent(String comment) {
        this.comment = comment;
    }

    @Override
    public Type getType() {
        return Type.COMMENT;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return "CommentEvent{comment='" + comment + "'}";
    }
}
