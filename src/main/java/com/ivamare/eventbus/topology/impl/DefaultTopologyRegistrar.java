package com.ivamare.eventbus.topology.impl;

import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.connection.ConnectionSupervisor;
import com.ivamare.eventbus.model.QueueDescriptor;
import com.ivamare.eventbus.model.QueueOptions;
import com.ivamare.eventbus.topology.TopologyRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Default implementation of TopologyRegistrar.
 */
public class DefaultTopologyRegistrar implements TopologyRegistrar {

    private static final Logger log = LoggerFactory.getLogger(DefaultTopologyRegistrar.class);

    private final ConnectionSupervisor supervisor;
    private final String deadLetterExchange;
    private final Executor executor;
    private final Set<String> managedQueues = ConcurrentHashMap.newKeySet();

    public DefaultTopologyRegistrar(ConnectionSupervisor supervisor, String deadLetterExchange, Executor executor) {
        this.supervisor = supervisor;
        this.deadLetterExchange = deadLetterExchange != null
            ? deadLetterExchange
            : BrokerNames.DEFAULT_DEAD_LETTER_EXCHANGE;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<String> createQueue(String queueName, QueueOptions options) {
        requireName(queueName, "Queue name");
        QueueOptions opts = options != null ? options : QueueOptions.defaults();

        QueueDescriptor queue = new QueueDescriptor(
            queueName,
            opts.durable() == null || opts.durable(),
            opts.deadLetterExchange() != null ? opts.deadLetterExchange() : deadLetterExchange,
            opts.deadLetterRoutingKey() != null
                ? opts.deadLetterRoutingKey()
                : BrokerNames.deadLetterRoutingKey(queueName),
            opts.messageTtl(),
            opts.maxLength()
        );
        QueueDescriptor dlq = QueueDescriptor.durable(BrokerNames.dlq(queueName));

        return supervisor.acquireSession().thenApplyAsync(session -> {
            session.declareQueue(queue);
            session.declareQueue(dlq);
            session.bindQueue(dlq.name(), queue.deadLetterExchange(), queue.deadLetterRoutingKey());
            managedQueues.add(queueName);

            log.info("Declared queue {} with dead-letter queue {} via {} ({})",
                queueName, dlq.name(), queue.deadLetterExchange(), queue.deadLetterRoutingKey());
            return queueName;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> bindQueue(String queueName, String exchange, List<String> routingKeys) {
        requireName(queueName, "Queue name");
        requireName(exchange, "Exchange name");
        if (routingKeys == null || routingKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one routing key is required");
        }
        List<String> keys = List.copyOf(routingKeys);

        return supervisor.acquireSession().thenAcceptAsync(session -> bindAll(session, queueName, exchange, keys),
            executor);
    }

    @Override
    public boolean isManaged(String queueName) {
        return managedQueues.contains(queueName);
    }

    private void bindAll(BrokerSession session, String queueName, String exchange, List<String> keys) {
        for (String key : keys) {
            session.bindQueue(queueName, exchange, key);
            log.debug("Bound {} to {} with {}", queueName, exchange, key);
        }
        log.info("Bound queue {} to exchange {} with {} routing key(s)", queueName, exchange, keys.size());
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
