package io.taskrelay.client;

import io.taskrelay.spec.Endpoint;

/**
 * Result of {@link ForwardingClient#send}.
 *
 * @param endpoint where the task was forwarded
 * @param streaming whether events arrive over {@code message/stream}, as opposed to a single
 *                  blocking {@code message/send}
 * @param events the events, to be drained by the caller
 */
public record BlockingOutcome(Endpoint endpoint, boolean streaming, EventStream events) {
}
