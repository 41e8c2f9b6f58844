package io.taskrelay.webhook;

import io.taskrelay.server.config.ProxyConfig;
import io.taskrelay.server.executor.ProxyAgentExecutor;
import io.taskrelay.server.store.EventStore;
import io.taskrelay.server.store.InMemoryEventStore;
import io.taskrelay.util.Assert;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the proxy executor and the webhook receiver around one shared {@link EventStore} and
 * serves the receiver over HTTP.
 */
public class WebhookReceiverApplication implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookReceiverApplication.class);

    private final ProxyConfig config;
    private final EventStore eventStore;
    private final ProxyAgentExecutor executor;
    private final Vertx vertx;
    private final WebhookServer server;
    private int port = -1;

    public WebhookReceiverApplication(ProxyConfig config) {
        this(config, new InMemoryEventStore());
    }

    public WebhookReceiverApplication(ProxyConfig config, EventStore eventStore) {
        this.config = Assert.checkNotNullParam("config", config);
        this.eventStore = Assert.checkNotNullParam("eventStore", eventStore);
        this.executor = ProxyAgentExecutor.create(config, eventStore);
        this.vertx = Vertx.vertx();
        this.server = new WebhookServer(vertx, new WebhookReceiver(eventStore), config.protocol());
    }

    public static void main(String[] args) {
        WebhookReceiverApplication application = new WebhookReceiverApplication(ProxyConfig.load());
        Runtime.getRuntime().addShutdownHook(new Thread(application::close, "taskrelay-shutdown"));
        application.start();
    }

    /**
     * @return the port the webhook receiver is bound to
     */
    public synchronized int start() {
        if (!config.webhookEnabled()) {
            LOGGER.warn("{} is not set; tasks will be forwarded in blocking mode only", ProxyConfig.PUBLIC_BASE_URL);
        }
        port = server.start(config.webhookHost(), config.webhookPort());
        return port;
    }

    public synchronized int port() {
        return port;
    }

    public ProxyAgentExecutor executor() {
        return executor;
    }

    public EventStore eventStore() {
        return eventStore;
    }

    @Override
    public synchronized void close() {
        server.stop();
        vertx.close();
        port = -1;
    }
}
