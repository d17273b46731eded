package com.ureca.eventbus.event.repository;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.entity.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface EventRepository extends JpaRepository<Event, UUID> {

    /**
     * 실시간 경로 claim: PENDING 에서 PROCESSING 으로 원자적 전이
     * 이미 다른 워커가 가져갔거나 만료된 이벤트면 0 반환 (ClaimConflict)
     *
     * @param id         이벤트 ID
     * @param workerId   claim 하는 워커
     * @param leaseUntil claim 임대 만료 시각
     * @param now        현재 시각
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.status = 'PROCESSING', e.lockedBy = :workerId, e.lockedUntil = :leaseUntil " +
            "WHERE e.id = :id " +
            "AND e.status = 'PENDING' " +
            "AND e.expiresAt > :now " +
            "AND (e.lockedUntil IS NULL OR e.lockedUntil < :now)")
    int claimPending(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("leaseUntil") LocalDateTime leaseUntil,
            @Param("now") LocalDateTime now
    );

    /**
     * 재조정 대상 조회 (FOR UPDATE SKIP LOCKED)
     * <p>
     * 다른 인스턴스가 잠근 행은 기다리지 않고 건너뛴다
     * 임대가 남아 있거나 다음 확인 시각(locked_until)이 오지 않은 이벤트는 제외
     * 처리 가능해진 시각(locked_until, 없으면 created_at) 오름차순
     * 반드시 markClaimed 와 같은 트랜잭션에서 호출
     *
     * @return 처리 가능 시각 오름차순 이벤트 ID
     */
    @Query(value = "SELECT e.id FROM events e " +
            "WHERE e.status IN ('PENDING', 'PROCESSING') " +
            "AND e.created_at < :now " +
            "AND e.expires_at > :now " +
            "AND (e.locked_until IS NULL OR e.locked_until < :now) " +
            "ORDER BY COALESCE(e.locked_until, e.created_at) ASC " +
            "LIMIT :limit " +
            "FOR UPDATE SKIP LOCKED",
            nativeQuery = true)
    List<UUID> findClaimableIdsForUpdate(
            @Param("now") LocalDateTime now,
            @Param("limit") int limit
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.status = 'PROCESSING', e.lockedBy = :workerId, e.lockedUntil = :leaseUntil " +
            "WHERE e.id IN :ids " +
            "AND e.status IN ('PENDING', 'PROCESSING')")
    int markClaimed(
            @Param("ids") Collection<UUID> ids,
            @Param("workerId") String workerId,
            @Param("leaseUntil") LocalDateTime leaseUntil
    );

    List<Event> findAllByIdInOrderByCreatedAtAsc(Collection<UUID> ids);

    /**
     * 종료 상태 전이 (최초 1회만 성공)
     * processed_at 은 이 UPDATE 에서만 기록된다
     * 다른 워커가 임대를 가진 이벤트는 건드리지 않는다
     *
     * @param status   COMPLETED 또는 FAILED
     * @param workerId 임대 소유 워커
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.status = :status, e.processedAt = :now, e.errorMessage = :errorMessage, " +
            "e.lockedBy = NULL, e.lockedUntil = NULL " +
            "WHERE e.id = :id " +
            "AND e.status IN ('PENDING', 'PROCESSING') " +
            "AND (e.lockedBy IS NULL OR e.lockedBy = :workerId)")
    int markTerminal(
            @Param("id") UUID id,
            @Param("status") EventStatus status,
            @Param("errorMessage") String errorMessage,
            @Param("workerId") String workerId,
            @Param("now") LocalDateTime now
    );

    /**
     * 본인이 가진 임대만 해제
     * <p>
     * notBefore 를 locked_until 에 남겨 그 전에는 재조정 대상에서 빠진다
     * (재시도 대기, 비동기 시도 중, 다른 인스턴스 핸들러 대기)
     *
     * @param notBefore 다음 확인 시각, null 이면 다음 재조정 주기에 바로 대상
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.lockedBy = NULL, e.lockedUntil = :notBefore " +
            "WHERE e.id = :id AND e.lockedBy = :workerId")
    int releaseLease(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("notBefore") LocalDateTime notBefore
    );

    /**
     * 비동기 전달 후 완료 판정을 위한 재claim
     * 임대가 비어 있거나 만료된 PROCESSING 이벤트만 (다음 확인 시각은 무시)
     *
     * @return 업데이트된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.lockedBy = :workerId, e.lockedUntil = :leaseUntil " +
            "WHERE e.id = :id " +
            "AND e.status = 'PROCESSING' " +
            "AND (e.lockedBy IS NULL OR e.lockedUntil < :now)")
    int claimForCompletion(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("leaseUntil") LocalDateTime leaseUntil,
            @Param("now") LocalDateTime now
    );

    // 핸들러 실패 감사 기록 (이벤트 상태는 바꾸지 않음, 다른 워커 임대 중이면 건너뜀)
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Event e " +
            "SET e.retryCount = e.retryCount + 1, e.errorMessage = :errorMessage, e.lastErrorAt = :now " +
            "WHERE e.id = :id " +
            "AND e.status IN ('PENDING', 'PROCESSING') " +
            "AND (e.lockedBy IS NULL OR e.lockedBy = :workerId)")
    int recordHandlerFailure(
            @Param("id") UUID id,
            @Param("errorMessage") String errorMessage,
            @Param("workerId") String workerId,
            @Param("now") LocalDateTime now
    );

    long countByStatus(EventStatus status);

    /**
     * 만료 이벤트 일괄 삭제 (상태 무관)
     * 핸들러 기록도 같은 문장에서 삭제
     * 각 호출이 독립 트랜잭션
     *
     * @param now   현재 시각
     * @param limit 한 번에 삭제할 최대 건수
     * @return 삭제된 이벤트 수
     */
    @Transactional
    @Modifying
    @Query(value = "WITH doomed AS (" +
            "    SELECT id FROM events WHERE expires_at < :now LIMIT :limit FOR UPDATE SKIP LOCKED" +
            "), deleted_handlers AS (" +
            "    DELETE FROM event_handlers WHERE event_id IN (SELECT id FROM doomed)" +
            ") " +
            "DELETE FROM events WHERE id IN (SELECT id FROM doomed)",
            nativeQuery = true)
    int deleteExpiredEvents(
            @Param("now") LocalDateTime now,
            @Param("limit") int limit
    );

    /**
     * 보관 기간이 지났거나 만료된 종료 이벤트 일괄 삭제 (아카이브 비활성화 시)
     *
     * @param threshold 보관 기준 시각 (processed_at 이 이보다 이전이면 대상)
     * @return 삭제된 이벤트 수
     */
    @Transactional
    @Modifying
    @Query(value = "WITH doomed AS (" +
            "    SELECT id FROM events " +
            "    WHERE status IN ('COMPLETED', 'FAILED') " +
            "    AND (processed_at < :threshold OR expires_at < :now) " +
            "    LIMIT :limit FOR UPDATE SKIP LOCKED" +
            "), deleted_handlers AS (" +
            "    DELETE FROM event_handlers WHERE event_id IN (SELECT id FROM doomed)" +
            ") " +
            "DELETE FROM events WHERE id IN (SELECT id FROM doomed)",
            nativeQuery = true)
    int deleteTerminalEvents(
            @Param("threshold") LocalDateTime threshold,
            @Param("now") LocalDateTime now,
            @Param("limit") int limit
    );

    /**
     * 종료 이벤트를 아카이브로 복사한 뒤 삭제
     * <p>
     * 이벤트와 핸들러 기록을 한 문장에서 INSERT 후 DELETE (원자적)
     * 아카이브는 INSERT 만, 이미 있으면 무시
     *
     * @return 아카이브 후 삭제된 이벤트 수
     */
    @Transactional
    @Modifying
    @Query(value = "WITH doomed AS (" +
            "    SELECT id FROM events " +
            "    WHERE status IN ('COMPLETED', 'FAILED') " +
            "    AND (processed_at < :threshold OR expires_at < :now) " +
            "    LIMIT :limit FOR UPDATE SKIP LOCKED" +
            "), archived_handlers AS (" +
            "    INSERT INTO event_handlers_archive " +
            "        (id, event_id, subscription_id, status, retry_count, started_at, completed_at, error_message, archived_at) " +
            "    SELECT h.id, h.event_id, h.subscription_id, h.status, h.retry_count, h.started_at, h.completed_at, h.error_message, :now " +
            "    FROM event_handlers h WHERE h.event_id IN (SELECT id FROM doomed) " +
            "    ON CONFLICT (id) DO NOTHING" +
            "), archived_events AS (" +
            "    INSERT INTO events_archive " +
            "        (id, event_type, event_source, payload, tenant_id, company_id, user_id, status, " +
            "         retry_count, max_retries, created_at, processed_at, expires_at, error_message, archived_at) " +
            "    SELECT e.id, e.event_type, e.event_source, e.payload, e.tenant_id, e.company_id, e.user_id, e.status, " +
            "           e.retry_count, e.max_retries, e.created_at, e.processed_at, e.expires_at, e.error_message, :now " +
            "    FROM events e WHERE e.id IN (SELECT id FROM doomed) " +
            "    ON CONFLICT (id) DO NOTHING" +
            "), deleted_handlers AS (" +
            "    DELETE FROM event_handlers WHERE event_id IN (SELECT id FROM doomed)" +
            ") " +
            "DELETE FROM events WHERE id IN (SELECT id FROM doomed)",
            nativeQuery = true)
    int archiveTerminalEvents(
            @Param("threshold") LocalDateTime threshold,
            @Param("now") LocalDateTime now,
            @Param("limit") int limit
    );
}
