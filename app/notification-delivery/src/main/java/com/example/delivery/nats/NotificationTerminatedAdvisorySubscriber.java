/*
 * どこで: Notification Delivery NATS 購読
 * 何を: MSG_TERMINATED advisory を購読して通知 ID 付きで破棄を記録する
 * なぜ: 不正ペイロード等で TERM した配信メッセージを追跡するため
 */
package com.example.delivery.nats;

import com.example.delivery.config.NotificationNatsTerminatedAdvisoryProperties;
import com.example.delivery.config.NotificationQueueProperties;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationTerminatedAdvisorySubscriber extends JetStreamAdvisorySubscriber {

    public NotificationTerminatedAdvisorySubscriber(Connection connection,
            NotificationQueueProperties queueProperties,
            NotificationNatsTerminatedAdvisoryProperties advisoryProperties,
            BrokerDropRecorder recorder) {
        super(connection, queueProperties, recorder,
                "terminated",
                advisoryProperties.subject(),
                advisoryProperties.stream(),
                advisoryProperties.durable());
    }
}
