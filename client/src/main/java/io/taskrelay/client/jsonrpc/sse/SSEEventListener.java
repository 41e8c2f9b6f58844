package io.taskrelay.client.jsonrpc.sse;

import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.client.http.sse.DataEvent;
import io.taskrelay.client.http.sse.Event;
import io.taskrelay.spec.JSONRPCError;
import io.taskrelay.spec.ProtocolRejectionException;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.StreamingEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.taskrelay.util.Utils.OBJECT_MAPPER;

/**
 * Turns the data events of a {@code message/stream} response into protocol objects.
 * <p>
 * Each data event is a complete JSON-RPC response. A {@code result} goes to the event handler,
 * an {@code error} to the error handler as a {@link ProtocolRejectionException}. Data that
 * cannot be parsed is logged and skipped.
 */
public class SSEEventListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(SSEEventListener.class);
    private final Consumer<StreamingEventKind> eventHandler;
    private final Consumer<Throwable> errorHandler;

    public SSEEventListener(Consumer<StreamingEventKind> eventHandler,
                            Consumer<Throwable> errorHandler) {
        this.eventHandler = eventHandler;
        this.errorHandler = errorHandler;
    }

    public void onMessage(Event event) {
        LOGGER.debug("Streaming message received: {}", event);

        if (event instanceof DataEvent dataEvent) {
            try {
                handleMessage(OBJECT_MAPPER.readTree(dataEvent.getData()));
            } catch (JsonProcessingException e) {
                LOGGER.warn("Failed to parse JSON message: {}", dataEvent.getData());
            }
        }
    }

    public void onError(Throwable throwable) {
        errorHandler.accept(throwable);
    }

    private void handleMessage(JsonNode jsonNode) throws JsonProcessingException {
        if (jsonNode.has("error")) {
            JSONRPCError error = OBJECT_MAPPER.treeToValue(jsonNode.get("error"), JSONRPCError.class);
            errorHandler.accept(new ProtocolRejectionException(error));
        } else if (jsonNode.has("result")) {
            // result can be a Task, Message, TaskStatusUpdateEvent, or TaskArtifactUpdateEvent
            StreamingEventKind event;
            try {
                event = StreamingEvents.fromJson(jsonNode.path("result"));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Skipping streaming result: {}", e.getMessage());
                return;
            }
            eventHandler.accept(event);
        } else {
            LOGGER.warn("Skipping streaming message without result or error: {}", jsonNode);
        }
    }
}
