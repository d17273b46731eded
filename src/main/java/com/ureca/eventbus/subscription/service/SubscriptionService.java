package com.ureca.eventbus.subscription.service;

import com.ureca.eventbus.routing.PatternMatcher;
import com.ureca.eventbus.subscription.dto.SubscriptionRegistration;
import com.ureca.eventbus.subscription.dto.SubscriptionResponse;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.event.SubscriptionChangedEvent;
import com.ureca.eventbus.subscription.exception.InvalidSubscriptionException;
import com.ureca.eventbus.subscription.exception.SubscriptionNotFoundException;
import com.ureca.eventbus.subscription.repository.EventSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * 구독 영속화와 관리자 작업 (활성화, 비활성화)
 * 변경은 SubscriptionChangedEvent 로 알려 커밋 후 캐시를 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final EventSubscriptionRepository subscriptionRepository;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * (subscriber_name, handler_name) 기준 upsert
     * 재등록 시 패턴, 우선순위 등 선언 내용만 갱신하고 활성 여부와 통계는 유지
     */
    @Transactional
    public EventSubscription register(SubscriptionRegistration registration) {
        validate(registration);

        EventSubscription subscription = subscriptionRepository
                .findBySubscriberNameAndHandlerName(registration.subscriberName(), registration.handlerName())
                .map(existing -> {
                    existing.updateRegistration(
                            registration.pattern(),
                            registration.tenantId(),
                            registration.filterConditions(),
                            registration.priorityOrDefault(),
                            registration.deliveryModeOrDefault(),
                            registration.maxRetryAttemptsOrDefault(),
                            registration.retryDelaySecondsOrDefault(),
                            registration.callbackAddress()
                    );
                    return existing;
                })
                .orElseGet(registration::toEntity);

        EventSubscription saved = subscriptionRepository.saveAndFlush(subscription);
        eventPublisher.publishEvent(new SubscriptionChangedEvent(saved.getId()));

        log.info("[Subscription] 등록 완료. subscriber: {}, handler: {}, pattern: {}, priority: {}, remote: {}",
                saved.getSubscriberName(), saved.getHandlerName(), saved.getPattern(),
                saved.getPriority(), saved.isRemote());
        return saved;
    }

    @Transactional
    public SubscriptionResponse activate(UUID subscriptionId) {
        EventSubscription subscription = getSubscription(subscriptionId);
        subscription.activate();
        eventPublisher.publishEvent(new SubscriptionChangedEvent(subscriptionId));

        log.info("[Subscription] 활성화. subscriptionId: {}, handler: {}",
                subscriptionId, subscription.getHandlerName());
        return SubscriptionResponse.from(subscription);
    }

    @Transactional
    public SubscriptionResponse deactivate(UUID subscriptionId) {
        EventSubscription subscription = getSubscription(subscriptionId);
        subscription.deactivate();
        eventPublisher.publishEvent(new SubscriptionChangedEvent(subscriptionId));

        log.info("[Subscription] 비활성화. subscriptionId: {}, handler: {}",
                subscriptionId, subscription.getHandlerName());
        return SubscriptionResponse.from(subscription);
    }

    @Transactional(readOnly = true)
    public List<SubscriptionResponse> findAll() {
        return subscriptionRepository.findAllByOrderBySubscriberNameAscHandlerNameAsc().stream()
                .map(SubscriptionResponse::from)
                .toList();
    }

    private EventSubscription getSubscription(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    }

    private void validate(SubscriptionRegistration registration) {
        if (isBlank(registration.subscriberName()) || isBlank(registration.handlerName())) {
            throw new InvalidSubscriptionException("subscriber_name, handler_name 은 필수입니다.");
        }
        if (!PatternMatcher.isValidPattern(registration.pattern())) {
            throw new InvalidSubscriptionException("구독 패턴 형식 오류: " + registration.pattern());
        }
        if (registration.maxRetryAttemptsOrDefault() < 1) {
            throw new InvalidSubscriptionException("max_retry_attempts 는 1 이상이어야 합니다.");
        }
        if (registration.retryDelaySecondsOrDefault() < 0) {
            throw new InvalidSubscriptionException("retry_delay 는 0 이상이어야 합니다.");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
