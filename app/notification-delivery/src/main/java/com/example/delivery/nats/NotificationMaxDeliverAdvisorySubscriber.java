/*
 * どこで: Notification Delivery NATS 購読
 * 何を: MAX_DELIVERIES advisory を購読して通知 ID 付きで破棄を記録する
 * なぜ: nak が続き再配信上限に達した配信メッセージを追跡するため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationNatsAdvisoryProperties;
import com.example.delivery.config.NotificationQueueProperties;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationMaxDeliverAdvisorySubscriber extends JetStreamAdvisorySubscriber {

    public NotificationMaxDeliverAdvisorySubscriber(Connection connection,
            NotificationQueueProperties queueProperties,
            NotificationNatsAdvisoryProperties advisoryProperties,
            BrokerDropRecorder recorder) {
        super(connection, queueProperties, recorder,
                "max-deliver",
                advisoryProperties.subject(),
                advisoryProperties.stream(),
                advisoryProperties.durable());
    }
}
