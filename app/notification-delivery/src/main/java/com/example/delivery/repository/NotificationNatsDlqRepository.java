/*
 * どこで: Notification Delivery データアクセス
 * 何を: ブローカーが破棄した配信メッセージを notification_nats_dlq へ保存する
 * なぜ: 再配信上限や TERM で消えた通知を notification_id から追えるようにするため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.BrokerDroppedMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationNatsDlqRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * advisory は再配信されうるので stream_seq で冪等にする。
   *
   * @return 新規に記録した場合 true、既に記録済みなら false
   */
  public boolean insert(BrokerDroppedMessage dropped) {
    final String sql =
        """
        INSERT INTO notification_nats_dlq (
          stream_seq,
          kind,
          notification_id,
          retry_count,
          reason,
          created_at
        ) VALUES (
          :streamSeq,
          :kind,
          :notificationId,
          :retryCount,
          :reason,
          :createdAt
        )
        ON CONFLICT (stream_seq) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("streamSeq", dropped.streamSeq())
            .addValue("kind", dropped.kind())
            .addValue("notificationId", dropped.notificationId())
            .addValue("retryCount", dropped.retryCount())
            .addValue("reason", dropped.reason())
            .addValue("createdAt", toTimestamp(dropped.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }
}
