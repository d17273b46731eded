package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.common.WorkerIdentity;
import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.repository.EventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 이벤트 claim 서비스
 * <p>
 * claim 은 PROCESSING 전이와 임대(locked_by, locked_until) 설정을 한 트랜잭션에서 수행
 * 임대를 가진 워커만 이벤트를 처리하며, 워커가 죽으면 임대 만료 후 다른 워커가 가져간다
 */
@Slf4j
@Service
public class EventClaimService {

    private final EventRepository eventRepository;
    private final WorkerIdentity workerIdentity;
    private final Duration lease;

    public EventClaimService(
            EventRepository eventRepository,
            WorkerIdentity workerIdentity,
            EventBusProperties properties
    ) {
        this.eventRepository = eventRepository;
        this.workerIdentity = workerIdentity;
        this.lease = properties.reconciliation().lease();
    }

    /**
     * 단건 claim (실시간 경로)
     *
     * @param eventId 신호로 받은 이벤트 ID
     * @return claim 성공 시 이벤트, 다른 워커가 가졌거나 처리 대상이 아니면 empty
     */
    @Transactional
    public Optional<Event> claim(UUID eventId) {
        LocalDateTime now = LocalDateTime.now();
        int claimed = eventRepository.claimPending(eventId, workerIdentity.getWorkerId(), now.plus(lease), now);

        if (claimed == 0) {
            return Optional.empty();
        }
        return eventRepository.findById(eventId);
    }

    /**
     * 비동기 전달을 마친 뒤 완료 판정용 재claim
     * 다른 워커가 임대 중이면 empty (그 워커가 완료 판정)
     *
     * @return claim 성공 시 새로 읽은 이벤트
     */
    @Transactional
    public Optional<Event> claimForCompletion(UUID eventId) {
        LocalDateTime now = LocalDateTime.now();
        int claimed = eventRepository.claimForCompletion(eventId, workerIdentity.getWorkerId(), now.plus(lease), now);

        if (claimed == 0) {
            log.debug("[Claim] 완료 판정 재claim 실패, 임대 중. eventId: {}", eventId);
            return Optional.empty();
        }
        return eventRepository.findById(eventId);
    }

    /**
     * 배치 claim (재조정 경로)
     * SKIP LOCKED 조회와 임대 설정이 같은 트랜잭션이라 인스턴스 간 중복 claim 없음
     *
     * @param limit 최대 건수
     * @return 생성 시각 오름차순 이벤트 (claim 순서는 처리 가능 시각 기준)
     */
    @Transactional
    public List<Event> claimBatch(int limit) {
        LocalDateTime now = LocalDateTime.now();
        List<UUID> ids = eventRepository.findClaimableIdsForUpdate(now, limit);

        if (ids.isEmpty()) {
            return List.of();
        }

        eventRepository.markClaimed(ids, workerIdentity.getWorkerId(), now.plus(lease));
        log.debug("[Claim] 배치 claim 완료. 건수: {}, worker: {}", ids.size(), workerIdentity.getWorkerId());

        return eventRepository.findAllByIdInOrderByCreatedAtAsc(ids);
    }
}
