/*
 * どこで: Notification Delivery テスト
 * 何を: Postgres での lease 取得/CAS 更新/再投入 claim を検証する
 * なぜ: UPDATE ... RETURNING と SKIP LOCKED、CHECK 制約の挙動を統合テストで確認するため
 */
package com.example.delivery.repository;

import com.example.delivery.AbstractPostgresContainerTest;
import com.example.delivery.model.BrokerDroppedMessage;
import com.example.delivery.model.NotificationChannel;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.model.NotificationStatus;
import com.example.delivery.model.NotificationTransition;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

    private static final Duration LEASE = Duration.ofSeconds(60);

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private NotificationNatsDlqRepository dlqRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM notification_nats_dlq", new MapSqlParameterSource());
    }

    @Test
    void insertAndFindRoundTripsColumns() {
        Instant now = now();
        NotificationRecord record = NotificationRecord.newPending(
                UUID.randomUUID(), "u_1", NotificationChannel.SMS, "code", "+819012345678", now);

        notificationRepository.insert(record);

        NotificationRecord found = notificationRepository.findById(record.notificationId()).orElseThrow();
        assertThat(found.channel()).isEqualTo(NotificationChannel.SMS);
        assertThat(found.status()).isEqualTo(NotificationStatus.PENDING);
        assertThat(found.destination()).isEqualTo("+819012345678");
        assertThat(found.retryGeneration()).isZero();
        assertInstantCloseToMicros(now, found.createdAt());
    }

    @Test
    void findByUserIdFiltersChannelAndOrdersNewestFirst() {
        Instant now = now();
        NotificationRecord older = insertPending("u_list", NotificationChannel.EMAIL, now.minusSeconds(60));
        NotificationRecord newer = insertPending("u_list", NotificationChannel.EMAIL, now);
        insertPending("u_list", NotificationChannel.IN_APP, now);
        insertPending("u_other", NotificationChannel.EMAIL, now);

        List<NotificationRecord> emails =
                notificationRepository.findByUserId("u_list", NotificationChannel.EMAIL);
        List<NotificationRecord> all = notificationRepository.findByUserId("u_list", null);

        assertThat(emails).extracting(NotificationRecord::notificationId)
                .containsExactly(newer.notificationId(), older.notificationId());
        assertThat(all).hasSize(3);
    }

    @Test
    void claimForDeliveryIsExclusiveUntilLeaseExpires() {
        Instant now = now();
        NotificationRecord record = insertPending("u_lease", NotificationChannel.EMAIL, now);

        int first = notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-a", now, now.plus(LEASE));
        int second = notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-b", now, now.plus(LEASE));
        Instant afterExpiry = now.plus(LEASE).plusSeconds(1);
        int reclaimed = notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-b",
                afterExpiry, afterExpiry.plus(LEASE));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(reclaimed).isEqualTo(1);
        assertThat(notificationRepository.findById(record.notificationId()).orElseThrow().lockedBy())
                .isEqualTo("worker-b");
    }

    @Test
    void markSentRequiresLeaseOwner() {
        Instant now = now();
        NotificationRecord record = insertPending("u_sent", NotificationChannel.IN_APP, now);
        notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-a", now, now.plus(LEASE));

        NotificationTransition sentTransition = new NotificationTransition(
                NotificationStatus.SENT, 0, null, null, false);

        int stolen = notificationRepository.markSent(record, sentTransition, "worker-b", now);
        int updated = notificationRepository.markSent(record, sentTransition, "worker-a", now.plusSeconds(1));

        assertThat(stolen).isZero();
        assertThat(updated).isEqualTo(1);
        NotificationRecord sent = notificationRepository.findById(record.notificationId()).orElseThrow();
        assertThat(sent.status()).isEqualTo(NotificationStatus.SENT);
        assertThat(sent.lockedBy()).isNull();
        assertThat(sent.leaseUntil()).isNull();
        assertInstantCloseToMicros(now.plusSeconds(1), sent.sentAt());
    }

    @Test
    void markRetryScheduledStoresBackoffAndReleasesLease() {
        Instant now = now();
        NotificationRecord record = insertPending("u_retry", NotificationChannel.EMAIL, now);
        notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-a", now, now.plus(LEASE));
        NotificationTransition transition = new NotificationTransition(
                NotificationStatus.RETRY_SCHEDULED, 1, now.plusSeconds(30), "timeout", false);

        int updated = notificationRepository.markRetryScheduled(record, transition, "worker-a", now);

        assertThat(updated).isEqualTo(1);
        NotificationRecord scheduled = notificationRepository.findById(record.notificationId()).orElseThrow();
        assertThat(scheduled.status()).isEqualTo(NotificationStatus.RETRY_SCHEDULED);
        assertThat(scheduled.retryCount()).isEqualTo(1);
        assertThat(scheduled.lastError()).isEqualTo("timeout");
        assertThat(scheduled.lockedBy()).isNull();
        assertInstantCloseToMicros(now.plusSeconds(30), scheduled.nextRetryTime());
    }

    @Test
    void checkConstraintRejectsRetryCountAboveMax() {
        Instant now = now();
        NotificationRecord invalid = new NotificationRecord(
                UUID.randomUUID(), "u_bad", NotificationChannel.EMAIL, "m", "a@example.com",
                NotificationStatus.RETRY_SCHEDULED, 6, now, "x", 0, null, null, null, now, now, null, null);

        assertThatThrownBy(() -> notificationRepository.insert(invalid))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void claimDueRetriesMarksRequeuedAndSkipsClaimedRows() {
        Instant now = now();
        NotificationRecord due = insertScheduled("u_due", 1, now.minusSeconds(1));
        insertScheduled("u_future", 2, now.plusSeconds(600));

        List<NotificationRecord> claimed =
                notificationRepository.claimDueRetries(10, now, now.minus(Duration.ofMinutes(5)));
        List<NotificationRecord> again =
                notificationRepository.claimDueRetries(10, now.plusSeconds(1), now.minus(Duration.ofMinutes(5)));

        assertThat(claimed).extracting(NotificationRecord::notificationId)
                .containsExactly(due.notificationId());
        assertInstantCloseToMicros(now, claimed.get(0).requeuedAt());
        assertThat(again).isEmpty();
    }

    @Test
    void releasedRequeueClaimCanBeClaimedAgain() {
        Instant now = now();
        NotificationRecord due = insertScheduled("u_release", 3, now.minusSeconds(1));
        NotificationRecord claimed = notificationRepository
                .claimDueRetries(10, now, now.minus(Duration.ofMinutes(5))).get(0);

        int released = notificationRepository.releaseRequeueClaim(due.notificationId(), claimed.requeuedAt());
        List<NotificationRecord> again =
                notificationRepository.claimDueRetries(10, now.plusSeconds(1), now.minus(Duration.ofMinutes(5)));

        assertThat(released).isEqualTo(1);
        assertThat(again).hasSize(1);
    }

    @Test
    void claimStalePendingOnlyReturnsOldUnleasedRows() {
        Instant now = now();
        NotificationRecord stale = insertPending("u_stale", NotificationChannel.SMS, now.minus(Duration.ofMinutes(10)));
        insertPending("u_fresh", NotificationChannel.SMS, now);

        List<NotificationRecord> claimed =
                notificationRepository.claimStalePending(10, now, now.minus(Duration.ofMinutes(5)));

        assertThat(claimed).extracting(NotificationRecord::notificationId)
                .containsExactly(stale.notificationId());
    }

    @Test
    void unpublishedDeadLetterIsClaimedAfterGraceUntilMarkedPublished() {
        Instant now = now();
        NotificationRecord record = insertPending("u_outbox", NotificationChannel.SMS, now);
        notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-a", now, now.plus(LEASE));
        NotificationRecord claimed = notificationRepository.findById(record.notificationId()).orElseThrow();
        int failed = notificationRepository.markFailedPermanently(claimed,
                new NotificationTransition(NotificationStatus.FAILED_PERMANENTLY, 5, null, "carrier rejected", true),
                "worker-a", now);
        Instant later = now.plusSeconds(31);

        List<NotificationRecord> withinGrace =
                notificationRepository.claimUnpublishedDeadLetters(10, now, now.minusSeconds(30));
        List<NotificationRecord> outbox =
                notificationRepository.claimUnpublishedDeadLetters(10, later, later.minusSeconds(30));
        List<NotificationRecord> alreadyClaimed =
                notificationRepository.claimUnpublishedDeadLetters(10, later.plusSeconds(1), later.minusSeconds(29));
        int published = notificationRepository.markDeadLetterPublished(record.notificationId(), 0, later);
        int publishedTwice = notificationRepository.markDeadLetterPublished(record.notificationId(), 0, later);
        Instant muchLater = later.plus(Duration.ofMinutes(10));
        List<NotificationRecord> afterPublish =
                notificationRepository.claimUnpublishedDeadLetters(10, muchLater, muchLater.minusSeconds(30));

        assertThat(failed).isEqualTo(1);
        assertThat(withinGrace).isEmpty();
        assertThat(outbox).extracting(NotificationRecord::notificationId)
                .containsExactly(record.notificationId());
        assertThat(outbox.get(0).retryCount()).isEqualTo(5);
        assertThat(alreadyClaimed).isEmpty();
        assertThat(published).isEqualTo(1);
        assertThat(publishedTwice).isZero();
        assertThat(afterPublish).isEmpty();
        assertThat(notificationRepository.findById(record.notificationId()).orElseThrow().requeuedAt()).isNull();
    }

    @Test
    void resetForManualRetryStartsNewGeneration() {
        Instant now = now();
        NotificationRecord record = insertPending("u_manual", NotificationChannel.EMAIL, now);
        notificationRepository.claimForDelivery(
                record.notificationId(), NotificationStatus.PENDING, 0, "worker-a", now, now.plus(LEASE));
        NotificationRecord claimed = notificationRepository.findById(record.notificationId()).orElseThrow();
        notificationRepository.markFailedPermanently(claimed,
                new NotificationTransition(NotificationStatus.FAILED_PERMANENTLY, 5, null, "bounced", true),
                "worker-a", now);

        Optional<NotificationRecord> unpublished = notificationRepository.resetForManualRetry(
                record.notificationId(), NotificationStatus.FAILED_PERMANENTLY, now);
        notificationRepository.markDeadLetterPublished(record.notificationId(), 0, now);
        Optional<NotificationRecord> wrongStatus = notificationRepository.resetForManualRetry(
                record.notificationId(), NotificationStatus.RETRY_SCHEDULED, now);
        Optional<NotificationRecord> reset = notificationRepository.resetForManualRetry(
                record.notificationId(), NotificationStatus.FAILED_PERMANENTLY, now.plusSeconds(1));

        assertThat(unpublished).isEmpty();
        assertThat(wrongStatus).isEmpty();
        assertThat(reset).isPresent();
        assertThat(reset.get().status()).isEqualTo(NotificationStatus.PENDING);
        assertThat(reset.get().retryCount()).isZero();
        assertThat(reset.get().retryGeneration()).isEqualTo(1);
        assertThat(reset.get().deadLetteredAt()).isNull();
    }

    @Test
    void countByStatusIncludesZeroBuckets() {
        Instant now = now();
        insertPending("u_count", NotificationChannel.EMAIL, now);
        insertScheduled("u_count", 1, now);

        Map<NotificationStatus, Long> counts = notificationRepository.countByStatus();

        assertThat(counts).containsEntry(NotificationStatus.PENDING, 1L)
                .containsEntry(NotificationStatus.RETRY_SCHEDULED, 1L)
                .containsEntry(NotificationStatus.SENT, 0L)
                .containsEntry(NotificationStatus.FAILED_PERMANENTLY, 0L);
        assertThat(notificationRepository.countBacklog()).isEqualTo(2);
    }

    @Test
    void dlqInsertStoresDroppedNotificationAndIgnoresDuplicateStreamSeq() {
        Instant now = now();
        UUID notificationId = UUID.randomUUID();
        BrokerDroppedMessage dropped = new BrokerDroppedMessage(
                42L, "terminated", notificationId, 3, "unknown notification id", now);

        boolean first = dlqRepository.insert(dropped);
        boolean duplicate = dlqRepository.insert(
                new BrokerDroppedMessage(42L, "max-deliver", null, null, null, now.plusSeconds(5)));

        assertThat(first).isTrue();
        assertThat(duplicate).isFalse();
        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT kind, notification_id, retry_count, reason, (SELECT COUNT(*) FROM notification_nats_dlq) AS total"
                        + " FROM notification_nats_dlq WHERE stream_seq = 42",
                new MapSqlParameterSource());
        assertThat(row).containsEntry("kind", "terminated")
                .containsEntry("notification_id", notificationId)
                .containsEntry("retry_count", 3)
                .containsEntry("reason", "unknown notification id")
                .containsEntry("total", 1L);
    }

    @Test
    void dlqInsertKeepsStreamSeqWhenBodyWasGone() {
        Instant now = now();

        boolean inserted = dlqRepository.insert(
                new BrokerDroppedMessage(7L, "max-deliver", null, null, null, now));

        assertThat(inserted).isTrue();
        Map<String, Object> row = jdbcTemplate.queryForMap(
                "SELECT notification_id, retry_count FROM notification_nats_dlq WHERE stream_seq = 7",
                new MapSqlParameterSource());
        assertThat(row.get("notification_id")).isNull();
        assertThat(row.get("retry_count")).isNull();
    }

    private NotificationRecord insertPending(String userId, NotificationChannel channel, Instant at) {
        String destination = channel == NotificationChannel.SMS ? "+819012345678"
                : channel == NotificationChannel.EMAIL ? "user@example.com" : null;
        NotificationRecord record = NotificationRecord.newPending(
                UUID.randomUUID(), userId, channel, "hello", destination, at);
        notificationRepository.insert(record);
        return record;
    }

    private NotificationRecord insertScheduled(String userId, int retryCount, Instant nextRetryTime) {
        Instant now = now();
        NotificationRecord record = new NotificationRecord(
                UUID.randomUUID(), userId, NotificationChannel.EMAIL, "hello", "user@example.com",
                NotificationStatus.RETRY_SCHEDULED, retryCount, nextRetryTime, "previous failure", 0,
                null, null, null, now, now, null, null);
        notificationRepository.insert(record);
        return record;
    }

    private Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private void assertInstantCloseToMicros(Instant expected, Instant actual) {
        // Postgres TIMESTAMPTZ はマイクロ秒精度のため、その範囲で比較する
        assertThat(actual).isNotNull();
        assertThat(Duration.between(expected, actual).abs()).isLessThanOrEqualTo(Duration.ofNanos(1_000));
    }
}
