package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.handler.entity.HandlerRecord;
import com.ureca.eventbus.handler.entity.HandlerStatus;
import com.ureca.eventbus.handler.repository.HandlerRecordRepository;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.service.SubscriptionCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 이벤트 완료 판정
 * <p>
 * 매번 현재 활성 구독으로 대상 집합을 다시 계산 (늦게 등록된 구독도 포함)
 * 대상이 없으면 COMPLETED
 * 기록이 없거나 PENDING 인 대상이 하나라도 있으면 진행 중
 * 모두 종료면 전부 성공일 때 COMPLETED, 아니면 FAILED
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventCompletionEvaluator {

    private final SubscriptionCache subscriptionCache;
    private final HandlerRecordRepository handlerRecordRepository;
    private final EventStatusUpdater statusUpdater;

    public CompletionDecision evaluate(Event event) {
        List<EventSubscription> matching = subscriptionCache.findMatching(event);
        Map<UUID, HandlerRecord> records = handlerRecordRepository.findAllByEventId(event.getId()).stream()
                .collect(Collectors.toMap(HandlerRecord::getSubscriptionId, Function.identity()));

        CompletionDecision decision = decide(matching, records);

        if (decision.isTerminal()) {
            statusUpdater.markTerminal(event, decision);
        } else {
            log.debug("[Completion] 진행 중. eventId: {}, 대상 구독 수: {}, 기록 수: {}",
                    event.getId(), matching.size(), records.size());
        }
        return decision;
    }

    static CompletionDecision decide(List<EventSubscription> matching, Map<UUID, HandlerRecord> records) {
        String firstError = null;

        for (EventSubscription subscription : matching) {
            HandlerRecord record = records.get(subscription.getId());
            if (record == null || !record.isTerminal()) {
                return CompletionDecision.inProgress();
            }
            if (record.getStatus() == HandlerStatus.FAILED && firstError == null) {
                firstError = record.getErrorMessage() != null
                        ? record.getErrorMessage()
                        : "handler failed: " + subscription.getHandlerName();
            }
        }

        return firstError == null ? CompletionDecision.completed() : CompletionDecision.failed(firstError);
    }
}
