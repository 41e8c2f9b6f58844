package io.taskrelay.client;

import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.SequenceHint;
import org.jspecify.annotations.Nullable;

/**
 * One event of a blocking forward, already classified.
 *
 * @param kind progress or one of the two terminal outcomes
 * @param sequenceHint position of a progress event
 * @param text status text, artifact text or the final result
 * @param remoteTaskId the target-side task id, once known
 * @param remoteState the target-side state the event was derived from
 * @param failure why the forward failed, for {@link Kind#FAILED}
 */
public record ForwardedEvent(Kind kind, @Nullable SequenceHint sequenceHint, @Nullable String text,
                             @Nullable String remoteTaskId, @Nullable String remoteState,
                             @Nullable FailureDetail failure) {

    public enum Kind {
        PROGRESS,
        COMPLETED,
        FAILED
    }

    public static ForwardedEvent progress(SequenceHint hint, @Nullable String text, @Nullable String remoteTaskId,
                                          @Nullable String remoteState) {
        return new ForwardedEvent(Kind.PROGRESS, hint, text, remoteTaskId, remoteState, null);
    }

    public static ForwardedEvent completed(String result, @Nullable String remoteTaskId) {
        return new ForwardedEvent(Kind.COMPLETED, null, result, remoteTaskId, "completed", null);
    }

    public static ForwardedEvent failed(FailureDetail failure, @Nullable String remoteTaskId) {
        return new ForwardedEvent(Kind.FAILED, null, failure.message(), remoteTaskId, failure.remoteState(), failure);
    }

    public static ForwardedEvent failed(FailureKind kind, String message) {
        return failed(new FailureDetail(kind, message), null);
    }

    public boolean isTerminal() {
        return kind != Kind.PROGRESS;
    }
}
