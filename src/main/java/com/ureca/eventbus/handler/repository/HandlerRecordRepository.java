package com.ureca.eventbus.handler.repository;

import com.ureca.eventbus.handler.entity.HandlerRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface HandlerRecordRepository extends JpaRepository<HandlerRecord, UUID> {

    /**
     * 첫 시도 기록 생성 (먼저 쓴 쪽이 이김)
     * <p>
     * (event_id, subscription_id) unique 제약으로 실시간 경로와 재조정 경로가
     * 동시에 시도해도 한 쪽만 1을 받는다
     * 이벤트 행이 없으면(정리로 삭제됨) 만들지 않는다
     * FOR KEY SHARE 로 커밋 전까지 정리 쪽 SKIP LOCKED 가 이 이벤트를 건너뛴다
     *
     * @param leaseUntil 시도 임대 만료 시각 (그 전에는 재조정 경로가 가져가지 않음)
     * @return 생성된 행 수 (0 또는 1)
     */
    @Modifying
    @Query(value = "INSERT INTO event_handlers " +
            "(id, event_id, subscription_id, status, retry_count, started_at, next_attempt_at) " +
            "SELECT gen_random_uuid(), :eventId, :subscriptionId, 'PENDING', 0, :now, :leaseUntil " +
            "WHERE EXISTS (SELECT 1 FROM events e WHERE e.id = :eventId FOR KEY SHARE) " +
            "ON CONFLICT (event_id, subscription_id) DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(
            @Param("eventId") UUID eventId,
            @Param("subscriptionId") UUID subscriptionId,
            @Param("now") LocalDateTime now,
            @Param("leaseUntil") LocalDateTime leaseUntil
    );

    /**
     * 재시도 시도 claim
     * PENDING 이고 다음 시도 시각이 지난 기록만 임대를 연장하며 가져간다
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE HandlerRecord h " +
            "SET h.nextAttemptAt = :leaseUntil, h.startedAt = :now " +
            "WHERE h.eventId = :eventId AND h.subscriptionId = :subscriptionId " +
            "AND h.status = 'PENDING' " +
            "AND h.nextAttemptAt <= :now")
    int claimRetryAttempt(
            @Param("eventId") UUID eventId,
            @Param("subscriptionId") UUID subscriptionId,
            @Param("now") LocalDateTime now,
            @Param("leaseUntil") LocalDateTime leaseUntil
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE HandlerRecord h " +
            "SET h.status = 'COMPLETED', h.completedAt = :now, h.errorMessage = NULL " +
            "WHERE h.eventId = :eventId AND h.subscriptionId = :subscriptionId " +
            "AND h.status = 'PENDING'")
    int markCompleted(
            @Param("eventId") UUID eventId,
            @Param("subscriptionId") UUID subscriptionId,
            @Param("now") LocalDateTime now
    );

    /**
     * 종료 실패 기록
     *
     * @param retryIncrement 재시도 소진이면 1, 재시도 불가 실패면 0 (예산 소모 없음)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE HandlerRecord h " +
            "SET h.status = 'FAILED', h.retryCount = h.retryCount + :retryIncrement, " +
            "h.completedAt = :now, h.errorMessage = :errorMessage " +
            "WHERE h.eventId = :eventId AND h.subscriptionId = :subscriptionId " +
            "AND h.status = 'PENDING'")
    int markFailed(
            @Param("eventId") UUID eventId,
            @Param("subscriptionId") UUID subscriptionId,
            @Param("retryIncrement") int retryIncrement,
            @Param("errorMessage") String errorMessage,
            @Param("now") LocalDateTime now
    );

    // 재시도 예약 (PENDING 유지)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE HandlerRecord h " +
            "SET h.retryCount = h.retryCount + 1, h.nextAttemptAt = :nextAttemptAt, " +
            "h.errorMessage = :errorMessage " +
            "WHERE h.eventId = :eventId AND h.subscriptionId = :subscriptionId " +
            "AND h.status = 'PENDING'")
    int scheduleRetry(
            @Param("eventId") UUID eventId,
            @Param("subscriptionId") UUID subscriptionId,
            @Param("nextAttemptAt") LocalDateTime nextAttemptAt,
            @Param("errorMessage") String errorMessage
    );

    Optional<HandlerRecord> findByEventIdAndSubscriptionId(UUID eventId, UUID subscriptionId);

    List<HandlerRecord> findAllByEventId(UUID eventId);

    // 가장 이른 재시도 또는 시도 임대 만료 시각
    @Query("SELECT MIN(h.nextAttemptAt) FROM HandlerRecord h " +
            "WHERE h.eventId = :eventId AND h.status = 'PENDING'")
    Optional<LocalDateTime> findEarliestPendingAttempt(@Param("eventId") UUID eventId);
}
