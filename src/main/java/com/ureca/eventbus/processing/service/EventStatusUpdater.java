package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.common.WorkerIdentity;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 이벤트 상태 업데이트 전담 컴포넌트
 * REQUIRES_NEW 로 각 업데이트를 독립 커밋
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStatusUpdater {

    private final EventRepository eventRepository;
    private final WorkerIdentity workerIdentity;

    /**
     * 종료 상태 전이 (COMPLETED 또는 FAILED)
     * WHERE 조건으로 비종료 상태이고 다른 워커 임대가 없을 때만 업데이트, 최초 1회만 성공
     *
     * @return 이번 호출로 전이했는지 여부
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markTerminal(Event event, CompletionDecision decision) {
        LocalDateTime now = LocalDateTime.now();
        int updated = eventRepository.markTerminal(
                event.getId(), decision.status(), decision.errorMessage(), workerIdentity.getWorkerId(), now);

        if (updated == 0) {
            log.debug("[Event] 이미 종료됨. eventId: {}", event.getId());
            return false;
        }

        event.transitionTo(decision.status(), now);
        log.info("[Event] 처리 종료. eventId: {}, eventType: {}, status: {}",
                event.getId(), event.getEventType(), decision.status());
        return true;
    }

    /**
     * 처리가 끝나지 않은 이벤트의 임대 반납
     *
     * @param notBefore 다음 재조정 대상이 되는 시각, null 이면 다음 주기에 바로 대상
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void releaseLease(UUID eventId, LocalDateTime notBefore) {
        int updated = eventRepository.releaseLease(eventId, workerIdentity.getWorkerId(), notBefore);

        if (updated == 0) {
            log.debug("[Event] 반납할 임대 없음. eventId: {}", eventId);
            return;
        }
        log.debug("[Event] 임대 반납. eventId: {}, 다음 확인: {}", eventId, notBefore);
    }
}
