/*
 * どこで: Notification Delivery NATS 購読
 * 何を: consumer advisory 用 stream と durable consumer を張り、受信分を BrokerDropRecorder へ渡す
 * なぜ: advisory はコア NATS の一時 subject なので、stream に取り込まないと停止中に取りこぼすため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationQueueProperties;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

abstract class JetStreamAdvisorySubscriber {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final Connection connection;
    private final NotificationQueueProperties queueProperties;
    private final BrokerDropRecorder recorder;
    private final String kind;
    private final String subject;
    private final String stream;
    private final String durable;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    JetStreamAdvisorySubscriber(Connection connection,
            NotificationQueueProperties queueProperties,
            BrokerDropRecorder recorder,
            String kind,
            String subject,
            String stream,
            String durable) {
        this.connection = connection;
        this.queueProperties = queueProperties;
        this.recorder = recorder;
        this.kind = kind;
        this.subject = subject;
        this.stream = stream;
        this.durable = durable;
    }

    @PostConstruct
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        try {
            JetStreamStreams.upsert(connection.jetStreamManagement(), StreamConfiguration.builder()
                    .name(stream)
                    .subjects(subject)
                    .storageType(StorageType.File)
                    .build());
            dispatcher = connection.createDispatcher();
            subscription = connection.jetStream().subscribe(subject, dispatcher, this::handleMessage, false,
                    PushSubscribeOptions.builder()
                            .stream(stream)
                            .durable(durable)
                            .configuration(ConsumerConfiguration.builder()
                                    .ackPolicy(AckPolicy.Explicit)
                                    // 本文の引き直しは primary の ack-wait 内に収まる
                                    .ackWait(queueProperties.ackWait())
                                    .maxDeliver(queueProperties.maxDeliver())
                                    .build())
                            .build());
            logger.info("broker drop advisory subscriber started kind={} subject={} stream={} durable={}",
                    kind, subject, stream, durable);
        } catch (IOException | JetStreamApiException ex) {
            stop();
            throw new IllegalStateException("failed to start " + kind + " advisory subscription", ex);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        BrokerDropRecorder.Settlement settlement;
        try {
            settlement = recorder.record(kind, message.getData());
        } catch (RuntimeException ex) {
            logger.warn("failed to record {} advisory", kind, ex);
            settlement = BrokerDropRecorder.Settlement.NAK;
        }
        try {
            if (settlement == BrokerDropRecorder.Settlement.ACK) {
                message.ack();
            } else {
                message.nak();
            }
        } catch (IllegalStateException ex) {
            logger.warn("failed to settle {} advisory settlement={}", kind, settlement, ex);
        }
    }
}
