package com.ureca.eventbus.handler.service;

import com.ureca.eventbus.common.WorkerIdentity;
import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.dispatch.DispatchOutcome;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.repository.EventRepository;
import com.ureca.eventbus.handler.entity.HandlerRecord;
import com.ureca.eventbus.handler.entity.HandlerStatus;
import com.ureca.eventbus.handler.repository.HandlerRecordRepository;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.repository.EventSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * 핸들러 기록 전담 컴포넌트
 * <p>
 * 시도 획득과 결과 기록을 REQUIRES_NEW 로 각각 독립 커밋
 * 한 구독의 기록 실패가 다른 구독 처리에 영향 주지 않는다
 */
@Slf4j
@Component
public class HandlerRecordService {

    private final HandlerRecordRepository handlerRecordRepository;
    private final EventRepository eventRepository;
    private final EventSubscriptionRepository subscriptionRepository;
    private final RetryCoordinator retryCoordinator;
    private final WorkerIdentity workerIdentity;
    private final Duration attemptLease;

    public HandlerRecordService(
            HandlerRecordRepository handlerRecordRepository,
            EventRepository eventRepository,
            EventSubscriptionRepository subscriptionRepository,
            RetryCoordinator retryCoordinator,
            WorkerIdentity workerIdentity,
            EventBusProperties properties
    ) {
        this.handlerRecordRepository = handlerRecordRepository;
        this.eventRepository = eventRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.retryCoordinator = retryCoordinator;
        this.workerIdentity = workerIdentity;
        this.attemptLease = properties.dispatch().attemptLease();
    }

    /**
     * 실시간 경로: 기록이 없을 때만 첫 시도 획득
     * 기록이 이미 있으면 (이전 실행, 재조정 경로) 처리된 것으로 보고 건너뛴다
     *
     * @return 시도 권한 획득 여부
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acquireFirstAttempt(UUID eventId, UUID subscriptionId) {
        LocalDateTime now = LocalDateTime.now();
        int inserted = handlerRecordRepository.insertIfAbsent(
                eventId, subscriptionId, now, now.plus(attemptLease));

        if (inserted == 0) {
            log.debug("[Handler Record] 기록 존재, 건너뜀. eventId: {}, subscriptionId: {}",
                    eventId, subscriptionId);
            return false;
        }
        return true;
    }

    /**
     * 재조정 경로: 첫 시도 또는 재시도 시각이 지난 PENDING 기록 획득
     *
     * @return 시도 권한 획득 여부
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acquireAttempt(UUID eventId, UUID subscriptionId) {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime leaseUntil = now.plus(attemptLease);

        if (handlerRecordRepository.insertIfAbsent(eventId, subscriptionId, now, leaseUntil) == 1) {
            return true;
        }

        int claimed = handlerRecordRepository.claimRetryAttempt(eventId, subscriptionId, now, leaseUntil);
        if (claimed == 0) {
            log.debug("[Handler Record] 종료됨 또는 재시도 대기, 건너뜀. eventId: {}, subscriptionId: {}",
                    eventId, subscriptionId);
            return false;
        }
        return true;
    }

    // 재조정 경로가 이 이벤트를 다시 볼 시각 (PENDING 기록이 없으면 empty)
    @Transactional(readOnly = true)
    public Optional<LocalDateTime> findEarliestPendingAttempt(UUID eventId) {
        return handlerRecordRepository.findEarliestPendingAttempt(eventId);
    }

    /**
     * 전달 결과 기록
     * 실패면 RetryCoordinator 결정에 따라 재시도 예약 또는 FAILED
     *
     * @return 기록 후 핸들러 상태
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public HandlerStatus recordOutcome(Event event, EventSubscription subscription, DispatchOutcome outcome) {
        LocalDateTime now = LocalDateTime.now();
        UUID eventId = event.getId();
        UUID subscriptionId = subscription.getId();

        if (outcome.success()) {
            handlerRecordRepository.markCompleted(eventId, subscriptionId, now);
            subscriptionRepository.recordDelivery(subscriptionId, 1, 0, now);
            log.debug("[Handler Record] 성공 기록. eventId: {}, handler: {}",
                    eventId, subscription.getHandlerName());
            return HandlerStatus.COMPLETED;
        }

        HandlerRecord record = handlerRecordRepository.findByEventIdAndSubscriptionId(eventId, subscriptionId)
                .orElseThrow(() -> new IllegalStateException(
                        "시도 획득 없이 결과 기록. eventId: " + eventId + ", subscriptionId: " + subscriptionId));

        RetryDecision decision = retryCoordinator.onFailure(
                record.getRetryCount(),
                retryCoordinator.effectiveMaxAttempts(subscription, event),
                subscription.getRetryDelay(),
                outcome.retryable(),
                now
        );

        eventRepository.recordHandlerFailure(eventId, outcome.error(), workerIdentity.getWorkerId(), now);

        if (decision.isTerminal()) {
            handlerRecordRepository.markFailed(
                    eventId, subscriptionId, decision.retryIncrement(), outcome.error(), now);
            subscriptionRepository.recordDelivery(subscriptionId, 0, 1, now);
            log.warn("[Handler Record] 최종 실패. eventId: {}, handler: {}, retryable: {}, retryCount: {}, error: {}",
                    eventId, subscription.getHandlerName(), outcome.retryable(),
                    record.getRetryCount() + decision.retryIncrement(), outcome.error());
            return HandlerStatus.FAILED;
        }

        handlerRecordRepository.scheduleRetry(eventId, subscriptionId, decision.nextAttemptAt(), outcome.error());
        log.info("[Handler Record] 재시도 예약. eventId: {}, handler: {}, retryCount: {}, nextAttemptAt: {}",
                eventId, subscription.getHandlerName(), record.getRetryCount() + 1, decision.nextAttemptAt());
        return HandlerStatus.PENDING;
    }
}
