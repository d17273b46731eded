package com.ureca.eventbus.subscription.dto;

import com.ureca.eventbus.subscription.entity.DeliveryMode;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import lombok.Builder;

import java.util.Map;

/**
 * 모듈 기동 시 구독 등록 요청
 *
 * @param subscriberName    모듈 이름
 * @param handlerName       핸들러 이름 (로컬 핸들러 테이블 키)
 * @param pattern           이벤트 타입 패턴 (세그먼트 단위 * 허용)
 * @param tenantId          테넌트 필터 (null 이면 전체)
 * @param filterConditions  추가 필터 조건 (null 이면 전체)
 * @param priority          높을수록 먼저 전달
 * @param deliveryMode      SYNC | ASYNC
 * @param maxRetryAttempts  최대 시도 횟수
 * @param retryDelaySeconds 재시도 기본 지연(초)
 * @param callbackAddress   원격 전달 주소 (null 이면 로컬)
 */
@Builder
public record SubscriptionRegistration(
        String subscriberName,
        String handlerName,
        String pattern,
        String tenantId,
        Map<String, Object> filterConditions,
        Integer priority,
        DeliveryMode deliveryMode,
        Integer maxRetryAttempts,
        Integer retryDelaySeconds,
        String callbackAddress
) {
    public static final int DEFAULT_PRIORITY = 5;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_RETRY_DELAY_SECONDS = 60;

    public int priorityOrDefault() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }

    public DeliveryMode deliveryModeOrDefault() {
        return deliveryMode == null ? DeliveryMode.ASYNC : deliveryMode;
    }

    public int maxRetryAttemptsOrDefault() {
        return maxRetryAttempts == null ? DEFAULT_MAX_RETRY_ATTEMPTS : maxRetryAttempts;
    }

    public int retryDelaySecondsOrDefault() {
        return retryDelaySeconds == null ? DEFAULT_RETRY_DELAY_SECONDS : retryDelaySeconds;
    }

    public EventSubscription toEntity() {
        return EventSubscription.builder()
                .subscriberName(subscriberName)
                .handlerName(handlerName)
                .pattern(pattern)
                .tenantId(tenantId)
                .filterConditions(filterConditions)
                .priority(priorityOrDefault())
                .deliveryMode(deliveryModeOrDefault())
                .maxRetryAttempts(maxRetryAttemptsOrDefault())
                .retryDelaySeconds(retryDelaySecondsOrDefault())
                .callbackAddress(callbackAddress)
                .build();
    }
}
