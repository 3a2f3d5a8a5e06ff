/*
 * どこで: Notification Delivery NATS 初期化
 * 何を: primary/dead-letter の JetStream stream を起動時に作成/更新する
 * なぜ: publish/subscribe 前に永続 stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationQueueProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(NotificationJetStreamBootstrap.class);

    private final Connection connection;
    private final NotificationQueueProperties properties;
    private final AtomicBoolean ensured = new AtomicBoolean(false);

    public NotificationJetStreamBootstrap(Connection connection, NotificationQueueProperties properties) {
        this.connection = connection;
        this.properties = properties;
    }

    @PostConstruct
    public void ensureStreams() {
        if (ensured.get()) {
            return;
        }
        try {
            JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
            // 両 stream とも file storage。再起動で未処理メッセージを失わない
            JetStreamStreams.upsert(jetStreamManagement,
                    buildStream(properties.stream(), properties.subject()));
            JetStreamStreams.upsert(jetStreamManagement,
                    buildStream(properties.deadLetterStream(), properties.deadLetterSubject()));
            ensured.set(true);
            logger.info("notification streams ensured stream={} deadLetterStream={} duplicateWindow={}",
                    properties.stream(),
                    properties.deadLetterStream(),
                    properties.duplicateWindow());
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure notification JetStream streams", ex);
        }
    }

    private StreamConfiguration buildStream(String name, String subject) {
        return StreamConfiguration.builder()
                .name(name)
                .subjects(subject)
                .storageType(StorageType.File)
                .duplicateWindow(properties.duplicateWindow())
                .build();
    }
}
