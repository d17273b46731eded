package com.ureca.eventbus.subscription.dto;

import com.ureca.eventbus.subscription.entity.DeliveryMode;
import com.ureca.eventbus.subscription.entity.EventSubscription;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record SubscriptionResponse(
        UUID id,
        String subscriberName,
        String handlerName,
        String pattern,
        String tenantId,
        Map<String, Object> filterConditions,
        boolean active,
        int priority,
        DeliveryMode deliveryMode,
        int maxRetryAttempts,
        int retryDelaySeconds,
        String callbackAddress,
        LocalDateTime lastTriggeredAt,
        long totalEventsProcessed,
        long totalEventsFailed
) {
    public static SubscriptionResponse from(EventSubscription subscription) {
        return new SubscriptionResponse(
                subscription.getId(),
                subscription.getSubscriberName(),
                subscription.getHandlerName(),
                subscription.getPattern(),
                subscription.getTenantId(),
                subscription.getFilterConditions(),
                subscription.isActive(),
                subscription.getPriority(),
                subscription.getDeliveryMode(),
                subscription.getMaxRetryAttempts(),
                subscription.getRetryDelaySeconds(),
                subscription.getCallbackAddress(),
                subscription.getLastTriggeredAt(),
                subscription.getTotalEventsProcessed(),
                subscription.getTotalEventsFailed()
        );
    }
}
