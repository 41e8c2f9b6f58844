package io.taskrelay.client.http.jdk.sse;

import java.util.concurrent.Flow;
import java.util.function.Consumer;

import io.taskrelay.client.http.sse.CommentEvent;
import io.taskrelay.client.http.sse.DataEvent;
import io.taskrelay.client.http.sse.Event;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line subscriber that turns a {@code text/event-stream} body into {@link Event}s.
 * <p>
 * Fed by {@link java.net.http.HttpResponse.BodySubscribers#fromLineSubscriber(Flow.Subscriber)},
 * so every {@code onNext} is one line without its terminator. A blank line dispatches the
 * accumulated event.
 */
public class SSEHandler implements Flow.Subscriber<String> {

    private static final Logger LOG = LoggerFactory.getLogger(SSEHandler.class);

    private static final String UTF8_BOM = "\uFEFF";

    private static final String DEFAULT_EVENT_NAME = "message";

    private final Consumer<Event> eventConsumer;
    private final Consumer<Throwable> errorConsumer;
    private final Runnable completeHandler;

    private final StringBuilder dataBuffer = new StringBuilder();
    private String currentEventName = DEFAULT_EVENT_NAME;
    private String lastEventId = "";
    private boolean firstLine = true;

    private final Object lock = new Object();
    private Flow.@Nullable Subscription subscription;
    private volatile boolean cancelled;

    public SSEHandler(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer, Runnable completeHandler) {
        this.eventConsumer = eventConsumer;
        this.errorConsumer = errorConsumer;
        this.completeHandler = completeHandler;
    }

    /**
     * Stops delivery and releases the connection. Safe to call before the subscription started.
     */
    public void cancel() {
        Flow.Subscription current;
        synchronized (lock) {
            cancelled = true;
            current = subscription;
        }
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        boolean alreadyCancelled;
        synchronized (lock) {
            this.subscription = subscription;
            alreadyCancelled = cancelled;
        }
        if (alreadyCancelled) {
            subscription.cancel();
        } else {
            subscription.request(1);
        }
    }

    @Override
    public void onNext(String item) {
        if (cancelled) {
            return;
        }
        String line = item;
        if (firstLine) {
            firstLine = false;
            if (line.startsWith(UTF8_BOM)) {
                line = line.substring(UTF8_BOM.length());
            }
        }
        LOG.debug("got line `{}`", line);
        if (line.isEmpty()) {
            dispatch();
        } else if (line.startsWith(":")) {
            eventConsumer.accept(new CommentEvent(line.substring(1).trim()));
        } else {
            int colon = line.indexOf(':');
            if (colon < 0) {
                handleFieldValue(line, "");
            } else {
                handleFieldValue(line.substring(0, colon), stripLeadingSpaceIfPresent(line.substring(colon + 1)));
            }
        }
        Flow.Subscription current = subscription;
        if (current != null && !cancelled) {
            current.request(1);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        if (!cancelled) {
            errorConsumer.accept(throwable);
        }
    }

    @Override
    public void onComplete() {
        if (cancelled) {
            return;
        }
        // a final event without a trailing blank line still counts
        dispatch();
        completeHandler.run();
    }

    private void handleFieldValue(String fieldName, String value) {
        switch (fieldName) {
            case "event":
                currentEventName = value;
                break;
            case "data":
                dataBuffer.append(value).append("\n");
                break;
            case "id":
                if (!value.contains("\0")) {
                    lastEventId = value;
                }
                break;
            default:
                // retry and unknown fields are ignored
                break;
        }
    }

    private void dispatch() {
        if (dataBuffer.length() > 0) {
            dataBuffer.setLength(dataBuffer.length() - 1);
            LOG.debug("broadcasting new event named {} lastEventId is {}", currentEventName, lastEventId);
            eventConsumer.accept(new DataEvent(currentEventName, dataBuffer.toString(), lastEventId));
        }
        dataBuffer.setLength(0);
        currentEventName = DEFAULT_EVENT_NAME;
    }

    private static String stripLeadingSpaceIfPresent(String field) {
        if (!field.isEmpty() && field.charAt(0) == ' ') {
            return field.substring(1);
        }
        return field;
    }
}
