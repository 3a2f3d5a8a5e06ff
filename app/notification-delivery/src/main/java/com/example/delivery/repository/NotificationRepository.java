/*
 * どこで: Notification Delivery データアクセス
 * 何を: notifications テーブルの登録/取得/条件付き更新を担う
 * なぜ: 配信ワーカーとリトライスケジューラの単一書き込みを CAS で保証するため
 */
package com.example.delivery.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.model.NotificationStatus;
import com.example.delivery.model.NotificationTransition;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, user_id, channel, message, destination, status,
      retry_count, next_retry_time, last_error, retry_generation, requeued_at,
      locked_by, lease_until, created_at, updated_at, sent_at, dead_lettered_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          channel,
          message,
          destination,
          status,
          retry_count,
          next_retry_time,
          last_error,
          retry_generation,
          created_at,
          updated_at
        ) VALUES (
          :notificationId,
          :userId,
          :channel,
          :message,
          :destination,
          :status,
          :retryCount,
          :nextRetryTime,
          :lastError,
          :retryGeneration,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("channel", record.channel().name())
            .addValue("message", record.message())
            .addValue("destination", record.destination())
            .addValue("status", record.status().name())
            .addValue("retryCount", record.retryCount())
            .addValue("nextRetryTime", toTimestamp(record.nextRetryTime()))
            .addValue("lastError", record.lastError())
            .addValue("retryGeneration", record.retryGeneration())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = "SELECT " + COLUMNS + " FROM notifications WHERE notification_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByUserId(String userId, NotificationChannel channel) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM notifications WHERE user_id = :userId");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    if (channel != null) {
      sql.append(" AND channel = :channel");
      params.addValue("channel", channel.name());
    }
    sql.append(" ORDER BY created_at DESC, notification_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  /**
   * 配信 lease を取得する。
   *
   * <p>status/retry_count が期待値と一致し、lease が空きか期限切れの場合のみ成功する。
   */
  public int claimForDelivery(
      UUID notificationId,
      NotificationStatus expectedStatus,
      int expectedRetryCount,
      String lockedBy,
      Instant now,
      Instant leaseUntil) {
    final String sql =
        """
        UPDATE notifications
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND retry_count = :expectedRetryCount
          AND (locked_by IS NULL OR lease_until IS NULL OR lease_until <= :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("expectedRetryCount", expectedRetryCount)
            .addValue("lockedBy", lockedBy)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.update(sql, params);
  }

  /** 配信成功を反映する。遷移先は状態機械が返した {@code transition} に従う。 */
  public int markSent(
      NotificationRecord expected, NotificationTransition transition, String lockedBy, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = :targetStatus,
            sent_at = :sentAt,
            updated_at = :sentAt,
            next_retry_time = NULL,
            last_error = NULL,
            requeued_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND retry_count = :expectedRetryCount
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        casParams(expected, lockedBy)
            .addValue("targetStatus", transition.target().name())
            .addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markRetryScheduled(
      NotificationRecord expected, NotificationTransition transition, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'RETRY_SCHEDULED',
            retry_count = :retryCount,
            next_retry_time = :nextRetryTime,
            last_error = :lastError,
            updated_at = :now,
            requeued_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND retry_count = :expectedRetryCount
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        casParams(expected, lockedBy)
            .addValue("retryCount", transition.retryCount())
            .addValue("nextRetryTime", toTimestamp(transition.nextRetryTime()))
            .addValue("lastError", transition.lastError())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * FAILED_PERMANENTLY へ遷移させる。
   *
   * <p>dead_letter_published_at は NULL のまま残り、この行が dead-letter 投入待ちの outbox になる。
   */
  public int markFailedPermanently(
      NotificationRecord expected, NotificationTransition transition, String lockedBy, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'FAILED_PERMANENTLY',
            retry_count = :retryCount,
            next_retry_time = NULL,
            last_error = :lastError,
            updated_at = :now,
            dead_lettered_at = :now,
            dead_letter_published_at = NULL,
            requeued_at = NULL,
            locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND retry_count = :expectedRetryCount
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        casParams(expected, lockedBy)
            .addValue("retryCount", transition.retryCount())
            .addValue("lastError", transition.lastError())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int releaseLease(UUID notificationId, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET locked_by = NULL,
            lease_until = NULL
        WHERE notification_id = :notificationId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  /** dead-letter 投入済みを記録する。同じ世代の outbox 行に対してだけ効く。 */
  public int markDeadLetterPublished(UUID notificationId, int retryGeneration, Instant publishedAt) {
    final String sql =
        """
        UPDATE notifications
        SET dead_letter_published_at = :publishedAt,
            requeued_at = NULL
        WHERE notification_id = :notificationId
          AND status = 'FAILED_PERMANENTLY'
          AND retry_generation = :retryGeneration
          AND dead_letter_published_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("retryGeneration", retryGeneration)
            .addValue("publishedAt", toTimestamp(publishedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * dead-letter 未投入のまま残った FAILED_PERMANENTLY を claim する。
   *
   * <p>claimBefore より前に終端化した行だけを対象にし、配信ワーカー自身の投入と競合しにくくする。
   */
  public List<NotificationRecord> claimUnpublishedDeadLetters(
      int limit, Instant now, Instant claimBefore) {
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notifications
          WHERE status = 'FAILED_PERMANENTLY'
            AND dead_letter_published_at IS NULL
            AND dead_lettered_at <= :claimBefore
            AND (requeued_at IS NULL OR requeued_at <= :claimBefore)
          ORDER BY dead_lettered_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET requeued_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
        RETURNING n.*
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("claimBefore", toTimestamp(claimBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * 期限到来した RETRY_SCHEDULED を claim し、再投入中マーカー requeued_at を立てる。
   *
   * <p>claim 済みでも reclaimBefore より古いものは、投入前に停止したとみなして再 claim する。
   */
  public List<NotificationRecord> claimDueRetries(int limit, Instant now, Instant reclaimBefore) {
    // 複数インスタンスの同時スキャンでも同一行を取り合わないよう SKIP LOCKED を使う
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notifications
          WHERE status = 'RETRY_SCHEDULED'
            AND next_retry_time <= :now
            AND (requeued_at IS NULL OR requeued_at <= :reclaimBefore)
          ORDER BY next_retry_time
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET requeued_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
        RETURNING n.*
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("reclaimBefore", toTimestamp(reclaimBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 投入に失敗したまま放置された PENDING を再投入のために claim する。 */
  public List<NotificationRecord> claimStalePending(int limit, Instant now, Instant staleBefore) {
    final String sql =
        """
        WITH cte AS (
          SELECT notification_id
          FROM notifications
          WHERE status = 'PENDING'
            AND updated_at <= :staleBefore
            AND (requeued_at IS NULL OR requeued_at <= :staleBefore)
            AND (lease_until IS NULL OR lease_until <= :now)
          ORDER BY updated_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET requeued_at = :now
        FROM cte
        WHERE n.notification_id = cte.notification_id
        RETURNING n.*
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("staleBefore", toTimestamp(staleBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int releaseRequeueClaim(UUID notificationId, Instant claimedAt) {
    final String sql =
        """
        UPDATE notifications
        SET requeued_at = NULL
        WHERE notification_id = :notificationId
          AND requeued_at = :claimedAt
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("claimedAt", toTimestamp(claimedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 手動リトライ: PENDING / retry_count=0 に戻し、世代を進める。
   *
   * <p>配信 lease が有効な間は更新しない。
   */
  public Optional<NotificationRecord> resetForManualRetry(
      UUID notificationId, NotificationStatus expectedStatus, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'PENDING',
            retry_count = 0,
            next_retry_time = NULL,
            retry_generation = retry_generation + 1,
            requeued_at = NULL,
            dead_lettered_at = NULL,
            dead_letter_published_at = NULL,
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = :expectedStatus
          AND (lease_until IS NULL OR lease_until <= :now)
          -- dead-letter 未投入のまま世代を進めると、その世代の DLQ メッセージが失われる
          AND (status <> 'FAILED_PERMANENTLY' OR dead_letter_published_at IS NOT NULL)
        RETURNING *
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("expectedStatus", expectedStatus.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Map<NotificationStatus, Long> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS cnt FROM notifications GROUP BY status";
    final Map<NotificationStatus, Long> counts = new EnumMap<>(NotificationStatus.class);
    for (NotificationStatus status : NotificationStatus.values()) {
      counts.put(status, 0L);
    }
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(NotificationStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
    return counts;
  }

  public int countBacklog() {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE status IN ('PENDING', 'RETRY_SCHEDULED')
        """;
    final Integer count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource casParams(NotificationRecord expected, String lockedBy) {
    return new MapSqlParameterSource()
        .addValue("notificationId", expected.notificationId())
        .addValue("expectedStatus", expected.status().name())
        .addValue("expectedRetryCount", expected.retryCount())
        .addValue("lockedBy", lockedBy);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        NotificationChannel.valueOf(rs.getString("channel")),
        rs.getString("message"),
        rs.getString("destination"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("retry_count"),
        toInstant(rs.getTimestamp("next_retry_time")),
        rs.getString("last_error"),
        rs.getInt("retry_generation"),
        toInstant(rs.getTimestamp("requeued_at")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("dead_lettered_at")));
  }
}
