/*
 * どこで: Notification Delivery NATS 購読
 * 何を: primary stream を固定数のワーカーで購読し配信エンジンへ渡す
 * なぜ: 明示 ack/nak/term で at-least-once を保ちつつ並列に配信するため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationDeliveryProperties;
import com.example.delivery.config.NotificationQueueProperties;
import com.example.delivery.model.NotificationQueueMessage;
import com.example.delivery.service.DeliveryOutcome;
import com.example.delivery.service.NotificationDeliveryEngine;
import com.example.delivery.service.NotificationMessagePermanentException;
import com.example.delivery.service.NotificationQueueException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationQueueSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(NotificationQueueSubscriber.class);

    private final Connection connection;
    private final NotificationJetStreamBootstrap bootstrap;
    private final NotificationDeliveryEngine deliveryEngine;
    private final NotificationQueueProperties properties;
    private final NotificationDeliveryProperties deliveryProperties;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private final List<Dispatcher> dispatchers = new ArrayList<>();
    private final List<JetStreamSubscription> subscriptions = new ArrayList<>();

    public NotificationQueueSubscriber(Connection connection,
            NotificationJetStreamBootstrap bootstrap,
            NotificationDeliveryEngine deliveryEngine,
            NotificationQueueProperties properties,
            NotificationDeliveryProperties deliveryProperties,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.bootstrap = bootstrap;
        this.deliveryEngine = deliveryEngine;
        this.properties = properties;
        this.deliveryProperties = deliveryProperties;
        this.objectMapper = objectMapper;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            bootstrap.ensureStreams();
            JetStream jetStream = connection.jetStream();
            // ワーカーごとに dispatcher を分け、同じ deliver group で負荷分散する
            for (int i = 0; i < properties.workers(); i++) {
                Dispatcher dispatcher = connection.createDispatcher();
                dispatchers.add(dispatcher);
                subscriptions.add(jetStream.subscribe(
                        properties.subject(),
                        properties.deliverGroup(),
                        dispatcher,
                        this::handleMessage,
                        false,
                        buildPushSubscribeOptions()));
            }
            logger.info("notification queue subscriber started subject={} stream={} durable={} workers={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable(),
                    properties.workers());
        } catch (IOException | JetStreamApiException ex) {
            stop();
            started.set(false);
            throw new IllegalStateException("failed to start notification queue subscription", ex);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        for (JetStreamSubscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        for (Dispatcher dispatcher : dispatchers) {
            connection.closeDispatcher(dispatcher);
        }
        dispatchers.clear();
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        try {
            NotificationQueueMessage payload =
                    objectMapper.readValue(message.getData(), NotificationQueueMessage.class);
            DeliveryOutcome outcome = deliveryEngine.process(payload);
            if (outcome == DeliveryOutcome.IN_FLIGHT_ELSEWHERE) {
                // lease 期限後に再評価させる
                nakWithDelaySilently(message);
                return;
            }
            message.ack();
        } catch (IOException ex) {
            // payload 破損は再配信で回復しないため恒久的に TERM する
            logger.warn("failed to parse notification queue message", ex);
            termSilently(message);
        } catch (NotificationMessagePermanentException ex) {
            logger.warn("permanent failure while handling notification queue message", ex);
            termSilently(message);
        } catch (DataAccessException | NotificationQueueException ex) {
            // DB/ブローカー障害は配信失敗として記録せず再配信させる
            logger.warn("temporary failure while handling notification queue message", ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            // 不明な例外はデータロス回避のため再配信に倒す
            logger.warn("failed to handle notification queue message", ex);
            nakSilently(message);
        }
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .deliverGroup(properties.deliverGroup())
                // ack-wait > lease は DeliveryAdapterConfig が起動時に検証する
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakWithDelaySilently(Message message) {
        try {
            message.nakWithDelay(deliveryProperties.lease());
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack notification queue message with delay", ex);
        }
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack notification queue message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term notification queue message", ex);
        }
    }
}
