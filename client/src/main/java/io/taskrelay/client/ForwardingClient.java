package io.taskrelay.client;

import java.util.concurrent.CompletableFuture;

import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.Endpoint;

/**
 * Sends tasks to a target agent.
 * <p>
 * Transport failures (refused connection, timeout) are always reported distinctly from the
 * target refusing the task: as {@link io.taskrelay.spec.FailureKind#TRANSPORT} and
 * {@link SubmissionOutcome.Status#TRANSPORT_ERROR} versus
 * {@link io.taskrelay.spec.FailureKind#PROTOCOL_REJECTION} and
 * {@link SubmissionOutcome.Status#REJECTED}. Nothing is retried.
 */
public interface ForwardingClient {

    /**
     * Forwards a task in blocking mode.
     * <p>
     * Never throws for transport or protocol problems; those arrive as the terminal event of
     * the returned stream.
     *
     * @param request the task to forward
     * @param endpoint the target agent
     * @return the outcome, whose event stream the caller drains
     */
    BlockingOutcome send(ForwardRequest request, Endpoint endpoint);

    /**
     * Submits a task together with a callback URL and returns as soon as the target has
     * answered the submission. Does not wait for the result.
     *
     * @param request the task to forward
     * @param endpoint the target agent
     * @param callbackUrl where the target should deliver updates
     * @return whether the target acknowledged the submission
     */
    SubmissionOutcome sendAsync(ForwardRequest request, Endpoint endpoint, String callbackUrl);

    /**
     * Asks the target to cancel one of its tasks. Best effort.
     *
     * @return completes with {@code true} if the target accepted the cancellation
     */
    CompletableFuture<Boolean> cancelRemote(Endpoint endpoint, String remoteTaskId);

    /**
     * Fetches the target's agent card. Cards are cached per endpoint URL.
     *
     * @throws io.taskrelay.spec.TransportException if the target could not be reached
     * @throws io.taskrelay.spec.ProtocolRejectionException if no readable card was served
     */
    AgentCard fetchAgentCard(Endpoint endpoint);
}
