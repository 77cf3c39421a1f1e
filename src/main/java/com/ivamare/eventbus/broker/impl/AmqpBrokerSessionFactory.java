package com.ivamare.eventbus.broker.impl;

import com.ivamare.eventbus.broker.BrokerNames;
import com.ivamare.eventbus.broker.BrokerSession;
import com.ivamare.eventbus.broker.BrokerSessionFactory;
import com.ivamare.eventbus.exception.ConnectionException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * RabbitMQ session factory using AMQP 0-9-1.
 *
 * <p>The client's automatic recovery is disabled: reconnection and topology
 * re-declaration are owned by the connection supervisor.
 */
public class AmqpBrokerSessionFactory implements BrokerSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(AmqpBrokerSessionFactory.class);

    private final int connectionTimeoutMs;
    private final int heartbeatSeconds;
    private final String connectionName;

    public AmqpBrokerSessionFactory() {
        this(30000, 60, "eventbus");
    }

    public AmqpBrokerSessionFactory(int connectionTimeoutMs, int heartbeatSeconds, String connectionName) {
        this.connectionTimeoutMs = connectionTimeoutMs;
        this.heartbeatSeconds = heartbeatSeconds;
        this.connectionName = connectionName;
    }

    @Override
    public BrokerSession connect(String url) {
        String maskedUrl = BrokerNames.maskUrl(url);
        Connection connection = null;
        try {
            ConnectionFactory factory = newConnectionFactory();
            factory.setUri(url);
            factory.setConnectionTimeout(connectionTimeoutMs);
            factory.setRequestedHeartbeat(heartbeatSeconds);
            factory.setAutomaticRecoveryEnabled(false);
            factory.setTopologyRecoveryEnabled(false);

            connection = factory.newConnection(connectionName);
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new IOException("No channel available on connection");
            }

            log.debug("Opened AMQP connection to {} ({}:{}{})", maskedUrl,
                factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new AmqpBrokerSession(connection, channel);
        } catch (Exception e) {
            closeQuietly(connection);
            throw new ConnectionException("Failed to connect to " + maskedUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Create the underlying client factory. Overridable for testing.
     *
     * @return new connection factory
     */
    protected ConnectionFactory newConnectionFactory() {
        return new ConnectionFactory();
    }

    private void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Ignoring error while closing half-open connection: {}", e.getMessage());
        }
    }
}
