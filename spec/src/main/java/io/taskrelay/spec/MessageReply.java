package io.taskrelay.spec;

/**
 * A target agent answered with a plain {@link Message} instead of a task.
 */
public record MessageReply(Message message) implements StreamingEventKind {

    @Override
    public String kind() {
        return Message.MESSAGE;
    }
}
