package com.ureca.eventbus.subscription.service;

import com.ureca.eventbus.dispatch.EventHandler;
import com.ureca.eventbus.routing.PatternMatcher;
import com.ureca.eventbus.subscription.dto.LocalRegistration;
import com.ureca.eventbus.subscription.dto.SubscriptionRegistration;
import com.ureca.eventbus.subscription.entity.DeliveryMode;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.exception.InvalidSubscriptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 프로세스 내 구독 등록부
 * <p>
 * 로컬 핸들러를 handler_name 으로 보관하고 구독 행을 영속화한다
 * findMatching 은 우선순위 내림차순, 같은 우선순위는 등록 순서
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionRegistry {

    private static final Comparator<LocalRegistration> DISPATCH_ORDER =
            Comparator.comparingInt(LocalRegistration::priority).reversed()
                    .thenComparingLong(LocalRegistration::sequence);

    private final SubscriptionService subscriptionService;
    private final LocalHandlerTable handlerTable;

    private final List<LocalRegistration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public EventSubscription register(String subscriberName, String handlerName, String pattern,
                                      int priority, EventHandler handler) {
        return register(SubscriptionRegistration.builder()
                .subscriberName(subscriberName)
                .handlerName(handlerName)
                .pattern(pattern)
                .priority(priority)
                .deliveryMode(DeliveryMode.SYNC)
                .build(), handler);
    }

    /**
     * 로컬 핸들러 구독 등록
     * 핸들러 테이블에 먼저 넣고 (중복 검사) 구독 행 저장에 실패하면 되돌린다
     */
    public EventSubscription register(SubscriptionRegistration registration, EventHandler handler) {
        if (registration.callbackAddress() != null) {
            throw new InvalidSubscriptionException("로컬 구독에는 callback_address 를 지정할 수 없습니다.");
        }
        if (!PatternMatcher.isValidPattern(registration.pattern())) {
            throw new InvalidSubscriptionException("구독 패턴 형식 오류: " + registration.pattern());
        }

        handlerTable.register(registration.handlerName(), handler);

        EventSubscription subscription;
        try {
            subscription = persist(registration);
        } catch (RuntimeException e) {
            handlerTable.unregister(registration.handlerName(), handler);
            throw e;
        }

        registrations.removeIf(existing -> existing.subscriptionId().equals(subscription.getId()));
        registrations.add(new LocalRegistration(
                subscription.getId(),
                subscription.getHandlerName(),
                subscription.getPattern(),
                subscription.getTenantId(),
                subscription.getPriority(),
                sequence.incrementAndGet()
        ));

        log.info("[Registry] 로컬 핸들러 등록. handler: {}, pattern: {}, priority: {}",
                subscription.getHandlerName(), subscription.getPattern(), subscription.getPriority());
        return subscription;
    }

    // 원격 구독 (핸들러 없이 구독 행만 저장, 재조정 경로에서 전달)
    public EventSubscription registerRemote(SubscriptionRegistration registration) {
        if (registration.callbackAddress() == null || registration.callbackAddress().isBlank()) {
            throw new InvalidSubscriptionException("원격 구독에는 callback_address 가 필요합니다.");
        }
        return persist(registration);
    }

    /**
     * 모듈 언로드 시 로컬 핸들러 제거
     * 구독 행은 남기며, 다른 인스턴스에 같은 핸들러가 있으면 그쪽에서 계속 처리된다
     */
    public void unregister(String handlerName) {
        handlerTable.find(handlerName).ifPresent(handler -> handlerTable.unregister(handlerName, handler));
        registrations.removeIf(registration -> registration.handlerName().equals(handlerName));
        log.info("[Registry] 로컬 핸들러 해제. handler: {}", handlerName);
    }

    public List<LocalRegistration> findMatching(String eventType) {
        return registrations.stream()
                .filter(registration -> PatternMatcher.matches(eventType, registration.pattern()))
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    public List<LocalRegistration> findMatching(String eventType, String tenantId) {
        return findMatching(eventType).stream()
                .filter(registration -> registration.tenantId() == null || registration.tenantId().equals(tenantId))
                .toList();
    }

    // 등록 순서 (이 프로세스에 등록되지 않은 구독이면 empty)
    public OptionalLong sequenceOf(UUID subscriptionId) {
        return registrations.stream()
                .filter(registration -> registration.subscriptionId().equals(subscriptionId))
                .mapToLong(LocalRegistration::sequence)
                .findFirst();
    }

    // 여러 인스턴스가 동시에 같은 구독을 처음 등록하면 unique 제약 충돌, 한 번 더 upsert
    private EventSubscription persist(SubscriptionRegistration registration) {
        try {
            return subscriptionService.register(registration);
        } catch (DataIntegrityViolationException e) {
            log.debug("[Registry] 동시 등록 충돌, 재시도. subscriber: {}, handler: {}",
                    registration.subscriberName(), registration.handlerName());
            return subscriptionService.register(registration);
        }
    }
}
