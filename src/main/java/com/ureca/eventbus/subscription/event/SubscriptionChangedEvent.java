package com.ureca.eventbus.subscription.event;

import java.util.UUID;

// 구독 등록, 활성화, 비활성화 (커밋 후 캐시 무효화용)
public record SubscriptionChangedEvent(UUID subscriptionId) {
}
