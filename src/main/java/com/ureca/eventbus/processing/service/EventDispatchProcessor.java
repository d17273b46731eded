package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.config.AsyncConfig;
import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.dispatch.DispatchOutcome;
import com.ureca.eventbus.dispatch.Dispatcher;
import com.ureca.eventbus.dispatch.DispatcherResolver;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.handler.service.HandlerRecordService;
import com.ureca.eventbus.routing.SubscriptionMatcher;
import com.ureca.eventbus.subscription.dto.LocalRegistration;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.service.SubscriptionCache;
import com.ureca.eventbus.subscription.service.SubscriptionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * claim 한 이벤트를 대상 구독에 전달
 * <p>
 * 구독 순서: 우선순위 내림차순, 같은 우선순위는 등록 순서 (로컬 등록 순번, 없으면 생성 시각)
 * 구독마다 핸들러 기록으로 시도 권한을 먼저 얻고, 얻은 경우에만 호출한다
 * SYNC 구독은 순서대로 직접 전달, ASYNC 구독은 임대 반납 후 Delivery Executor 에 넘긴다
 * 처리가 끝나면 완료 판정 후 다음 확인 시각을 남기고 임대 반납
 */
@Slf4j
@Component
public class EventDispatchProcessor {

    private final SubscriptionRegistry subscriptionRegistry;
    private final SubscriptionCache subscriptionCache;
    private final DispatcherResolver dispatcherResolver;
    private final HandlerRecordService handlerRecordService;
    private final EventCompletionEvaluator completionEvaluator;
    private final EventStatusUpdater statusUpdater;
    private final EventClaimService claimService;
    private final TaskExecutor deliveryExecutor;
    private final Duration idleRecheck;

    public EventDispatchProcessor(
            SubscriptionRegistry subscriptionRegistry,
            SubscriptionCache subscriptionCache,
            DispatcherResolver dispatcherResolver,
            HandlerRecordService handlerRecordService,
            EventCompletionEvaluator completionEvaluator,
            EventStatusUpdater statusUpdater,
            EventClaimService claimService,
            @Qualifier(AsyncConfig.DELIVERY_EXECUTOR_NAME) TaskExecutor deliveryExecutor,
            EventBusProperties properties
    ) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.subscriptionCache = subscriptionCache;
        this.dispatcherResolver = dispatcherResolver;
        this.handlerRecordService = handlerRecordService;
        this.completionEvaluator = completionEvaluator;
        this.statusUpdater = statusUpdater;
        this.claimService = claimService;
        this.deliveryExecutor = deliveryExecutor;
        this.idleRecheck = properties.reconciliation().idleRecheck();
    }

    /**
     * claim 한 이벤트 처리
     *
     * @param event claim 된 이벤트 (PROCESSING)
     * @param path  처리 경로
     * @return 완료 판정 결과
     */
    public CompletionDecision process(Event event, ProcessingPath path) {
        List<Runnable> asyncDeliveries = new ArrayList<>();
        boolean awaitingOtherInstance = false;
        try {
            List<EventSubscription> targets = path == ProcessingPath.LIVE
                    ? liveTargets(event)
                    : reconcileTargets(event);

            log.debug("[Dispatch] 처리 시작. eventId: {}, eventType: {}, path: {}, 대상 구독 수: {}",
                    event.getId(), event.getEventType(), path, targets.size());

            for (EventSubscription subscription : targets) {
                if (!deliverIfAcquired(event, subscription, path, asyncDeliveries)) {
                    awaitingOtherInstance = true;
                }
            }

            return completionEvaluator.evaluate(event);
        } finally {
            releaseLease(event, path, awaitingOtherInstance);
            asyncDeliveries.forEach(deliveryExecutor::execute);
        }
    }

    /**
     * @return 이 프로세스에서 전달할 수 없는 구독이면 false
     */
    private boolean deliverIfAcquired(Event event, EventSubscription subscription, ProcessingPath path,
                                      List<Runnable> asyncDeliveries) {
        Dispatcher dispatcher = dispatcherResolver.resolve(subscription);
        if (!dispatcher.canDispatch(subscription)) {
            // 다른 인스턴스에 등록된 로컬 핸들러
            log.debug("[Dispatch] 이 프로세스에서 전달 불가, 건너뜀. eventId: {}, handler: {}",
                    event.getId(), subscription.getHandlerName());
            return false;
        }

        boolean acquired = path == ProcessingPath.LIVE
                ? handlerRecordService.acquireFirstAttempt(event.getId(), subscription.getId())
                : handlerRecordService.acquireAttempt(event.getId(), subscription.getId());
        if (!acquired) {
            return true;
        }

        if (subscription.isAsync()) {
            asyncDeliveries.add(() -> deliverAsync(event, subscription, dispatcher));
        } else {
            deliver(event, subscription, dispatcher);
        }
        return true;
    }

    private void deliver(Event event, EventSubscription subscription, Dispatcher dispatcher) {
        DispatchOutcome outcome = dispatcher.dispatch(subscription, event);
        handlerRecordService.recordOutcome(event, subscription, outcome);
    }

    /**
     * 임대 반납 후 실행되므로 핸들러 기록만 쓰고, 완료 판정은 이벤트를 다시 claim 한 경우에만
     * 다른 워커가 임대 중이면 그 워커가 판정한다
     * 기록 실패 시 핸들러 기록은 PENDING 으로 남고 시도 임대가 끝나면 재조정 경로가 다시 시도
     */
    private void deliverAsync(Event event, EventSubscription subscription, Dispatcher dispatcher) {
        try {
            deliver(event, subscription, dispatcher);
            claimService.claimForCompletion(event.getId()).ifPresent(this::completeAfterAsync);
        } catch (DataAccessException e) {
            log.error("[Dispatch] 비동기 전달 결과 기록 실패. eventId: {}, handler: {}, error: {}",
                    event.getId(), subscription.getHandlerName(), e.getMessage());
        }
    }

    private void completeAfterAsync(Event claimed) {
        try {
            completionEvaluator.evaluate(claimed);
        } finally {
            releaseLease(claimed, ProcessingPath.RECONCILE, false);
        }
    }

    private void releaseLease(Event event, ProcessingPath path, boolean awaitingOtherInstance) {
        if (event.getStatus().isTerminal()) {
            return;
        }
        try {
            LocalDateTime notBefore = path == ProcessingPath.LIVE
                    ? null
                    : nextCheckAt(event.getId(), awaitingOtherInstance, LocalDateTime.now());
            statusUpdater.releaseLease(event.getId(), notBefore);
        } catch (DataAccessException e) {
            log.warn("[Dispatch] 임대 반납 실패, 만료 후 재claim. eventId: {}, error: {}",
                    event.getId(), e.getMessage());
        }
    }

    /**
     * 재조정 경로가 이 이벤트를 다시 볼 시각
     * <p>
     * 가장 이른 재시도 또는 시도 임대 만료 시각
     * 다른 인스턴스 핸들러를 기다리는 중이면 idleRecheck 후 (둘 다면 이른 쪽)
     * 둘 다 없으면 null (다음 주기에 바로 대상)
     */
    LocalDateTime nextCheckAt(UUID eventId, boolean awaitingOtherInstance, LocalDateTime now) {
        LocalDateTime earliestAttempt = handlerRecordService.findEarliestPendingAttempt(eventId).orElse(null);
        if (!awaitingOtherInstance) {
            return earliestAttempt;
        }

        LocalDateTime idleUntil = now.plus(idleRecheck);
        return earliestAttempt != null && earliestAttempt.isBefore(idleUntil) ? earliestAttempt : idleUntil;
    }

    // 실시간 경로: 이 프로세스에 등록된 로컬 구독만
    private List<EventSubscription> liveTargets(Event event) {
        return subscriptionRegistry.findMatching(event.getEventType(), event.getTenantId()).stream()
                .map(LocalRegistration::subscriptionId)
                .map(subscriptionCache::find)
                .flatMap(Optional::stream)
                .filter(subscription -> SubscriptionMatcher.matches(subscription, event))
                .toList();
    }

    // 재조정 경로: 원격 포함 전체 활성 구독
    private List<EventSubscription> reconcileTargets(Event event) {
        return subscriptionCache.findMatching(event).stream()
                .sorted(dispatchOrder())
                .toList();
    }

    Comparator<EventSubscription> dispatchOrder() {
        return Comparator.comparingInt(EventSubscription::getPriority).reversed()
                .thenComparingLong(subscription ->
                        subscriptionRegistry.sequenceOf(subscription.getId()).orElse(Long.MAX_VALUE))
                .thenComparing(EventSubscription::getCreatedAt,
                        Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                .thenComparing(subscription -> Objects.toString(subscription.getId()));
    }
}
