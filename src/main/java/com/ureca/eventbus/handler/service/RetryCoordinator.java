package com.ureca.eventbus.handler.service;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * (이벤트, 구독) 실패 시 재시도 여부와 다음 시도 시각 결정
 * <p>
 * 증가 후 retry_count 가 최대 시도 횟수 이상이면 FAILED, 아니면 PENDING 유지
 * 최대 시도 횟수는 구독의 max_retry_attempts 와 이벤트의 max_retries 중 작은 값
 */
@Component
public class RetryCoordinator {

    private final BackoffType backoffType;
    private final double multiplier;
    private final Duration maxDelay;

    public RetryCoordinator(EventBusProperties properties) {
        this.backoffType = properties.retry().backoff();
        this.multiplier = properties.retry().multiplier();
        this.maxDelay = properties.retry().maxDelay();
    }

    public RetryDecision onFailure(int currentRetryCount, int maxAttempts, Duration retryDelay,
                                   boolean retryable, LocalDateTime now) {
        if (!retryable) {
            return RetryDecision.permanent();
        }

        int retryCount = currentRetryCount + 1;
        if (retryCount >= maxAttempts) {
            return RetryDecision.exhausted();
        }

        return RetryDecision.retryAt(now.plus(nextDelay(retryDelay, retryCount)));
    }

    public int effectiveMaxAttempts(EventSubscription subscription, Event event) {
        return Math.max(1, Math.min(subscription.getMaxRetryAttempts(), event.getMaxRetries()));
    }

    /**
     * @param retryDelay 구독의 기본 재시도 지연
     * @param retryCount 증가 후 재시도 횟수 (1부터)
     */
    Duration nextDelay(Duration retryDelay, int retryCount) {
        if (backoffType == BackoffType.FIXED || retryCount <= 1) {
            return min(retryDelay, maxDelay);
        }

        double factor = Math.pow(multiplier, retryCount - 1);
        double delayMillis = retryDelay.toMillis() * factor;

        if (Double.isInfinite(delayMillis) || delayMillis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) delayMillis);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
