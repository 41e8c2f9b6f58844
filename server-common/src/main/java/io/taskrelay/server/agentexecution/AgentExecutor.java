package io.taskrelay.server.agentexecution;

import io.taskrelay.server.events.EventQueue;

/**
 * Executes a task on behalf of a caller and publishes what happens to the caller's
 * {@link EventQueue}.
 */
public interface AgentExecutor {

    void execute(RequestContext context, EventQueue eventQueue);

    void cancel(RequestContext context, EventQueue eventQueue);
}
