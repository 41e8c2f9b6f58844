package io.taskrelay.client.jsonrpc;

import io.taskrelay.client.ForwardedEvent;
import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.MessageReply;
import io.taskrelay.spec.SequenceHint;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Classifies what a target agent sends during a blocking forward. One instance per forward: it
 * numbers progress events and keeps streamed artifact text for the final result.
 */
final class EventTranslator {

    static final String DEFAULT_RESULT = "Task completed";

    private final StringBuilder streamedArtifacts = new StringBuilder();
    private int progressCount;
    private @Nullable String remoteTaskId;

    @Nullable String remoteTaskId() {
        return remoteTaskId;
    }

    /**
     * Translates one event received over {@code message/stream}.
     */
    ForwardedEvent translate(StreamingEventKind event) {
        if (event instanceof Task task) {
            remember(task.id());
            TaskState state = task.status().state();
            if (isStopping(state)) {
                return terminal(state, statusText(task), task);
            }
            return progress(state.asString(), task.firstAgentMessageText(), state);
        }
        if (event instanceof TaskStatusUpdateEvent update) {
            remember(update.taskId());
            TaskState state = update.status().state();
            String text = update.status().message() == null ? null : update.status().message().joinedText();
            if (isStopping(state)) {
                return terminal(state, text, null);
            }
            return progress(state.asString(), text, state);
        }
        if (event instanceof TaskArtifactUpdateEvent update) {
            remember(update.taskId());
            String text = update.artifact().joinedText();
            if (text != null) {
                streamedArtifacts.append(text);
            }
            return progress("artifact", text, null);
        }
        if (event instanceof MessageReply reply) {
            remember(reply.message().taskId());
            return ForwardedEvent.completed(Utils.defaultIfNull(reply.message().joinedText(), DEFAULT_RESULT),
                    remoteTaskId);
        }
        return ForwardedEvent.failed(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                "Unsupported event kind: " + event.kind()), remoteTaskId);
    }

    /**
     * Translates the single answer of a blocking {@code message/send}. A non-final task here means
     * the target ignored the blocking flag, which is reported as a rejection.
     */
    ForwardedEvent translateBlockingResult(StreamingEventKind event) {
        ForwardedEvent translated = translate(event);
        if (translated.isTerminal()) {
            return translated;
        }
        return ForwardedEvent.failed(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                "Target agent answered a blocking request with non-final state '" + translated.remoteState() + "'",
                translated.remoteState()), remoteTaskId);
    }

    private static boolean isStopping(TaskState state) {
        return state.isFinal() || state == TaskState.INPUT_REQUIRED || state == TaskState.AUTH_REQUIRED;
    }

    private ForwardedEvent progress(String stage, @Nullable String text, @Nullable TaskState state) {
        progressCount++;
        return ForwardedEvent.progress(new SequenceHint(progressCount, null, stage), text, remoteTaskId,
                state == null ? null : state.asString());
    }

    private ForwardedEvent terminal(TaskState state, @Nullable String statusText, @Nullable Task task) {
        switch (state) {
            case COMPLETED:
                return ForwardedEvent.completed(resultText(statusText, task), remoteTaskId);
            case INPUT_REQUIRED:
            case AUTH_REQUIRED:
                return ForwardedEvent.failed(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                        "Target agent requires interactive input (" + state.asString() + "), which is not supported"
                                + (statusText == null ? "" : ": " + statusText),
                        state.asString()), remoteTaskId);
            default:
                return ForwardedEvent.failed(new FailureDetail(FailureKind.PROTOCOL_REJECTION,
                        statusText == null ? "Target agent reported state '" + state.asString() + "'" : statusText,
                        state.asString()), remoteTaskId);
        }
    }

    private String resultText(@Nullable String statusText, @Nullable Task task) {
        if (task != null && task.agentHistoryText() != null) {
            return task.agentHistoryText();
        }
        if (statusText != null) {
            return statusText;
        }
        if (task != null && task.artifactsText() != null) {
            return task.artifactsText();
        }
        if (streamedArtifacts.length() > 0) {
            return streamedArtifacts.toString();
        }
        return DEFAULT_RESULT;
    }

    private static @Nullable String statusText(Task task) {
        return task.status().message() == null ? null : task.status().message().joinedText();
    }

    private void remember(@Nullable String taskId) {
        if (taskId != null && remoteTaskId == null) {
            remoteTaskId = taskId;
        }
    }
}
