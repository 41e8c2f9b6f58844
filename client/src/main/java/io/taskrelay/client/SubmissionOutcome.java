package io.taskrelay.client;

import io.taskrelay.spec.FailureDetail;
import io.taskrelay.spec.FailureKind;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link ForwardingClient#sendAsync}: whether the target took the task, not how it
 * ended.
 *
 * @param status the submission status
 * @param remoteTaskId the target-side task id, when the target created one
 * @param remoteState the target-side state reported on submission
 * @param agentMessage the first agent text of the acknowledgement, if any
 * @param failure why the submission did not succeed
 */
public record SubmissionOutcome(Status status, @Nullable String remoteTaskId, @Nullable String remoteState,
                                @Nullable String agentMessage, @Nullable FailureDetail failure) {

    public enum Status {
        /** The target acknowledged receipt; the result arrives by callback. */
        SUBMITTED,
        /** The target answered but refused the task. */
        REJECTED,
        /** The target could not be reached. */
        TRANSPORT_ERROR
    }

    public static SubmissionOutcome submitted(@Nullable String remoteTaskId, @Nullable String remoteState,
                                              @Nullable String agentMessage) {
        return new SubmissionOutcome(Status.SUBMITTED, remoteTaskId, remoteState, agentMessage, null);
    }

    public static SubmissionOutcome rejected(FailureDetail failure) {
        return new SubmissionOutcome(Status.REJECTED, null, failure.remoteState(), null, failure);
    }

    public static SubmissionOutcome transportError(String message) {
        return new SubmissionOutcome(Status.TRANSPORT_ERROR, null, null, null,
                new FailureDetail(FailureKind.TRANSPORT, message));
    }

    public boolean isSubmitted() {
        return status == Status.SUBMITTED;
    }
}
