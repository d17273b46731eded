package com.ureca.eventbus.subscription.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import java.util.UUID;

import static com.ureca.eventbus.common.BaseCode.SUBSCRIPTION_NOT_FOUND;

public class SubscriptionNotFoundException extends BusinessException {

    public SubscriptionNotFoundException(UUID subscriptionId) {
        super(SUBSCRIPTION_NOT_FOUND, "구독 없음. subscriptionId: " + subscriptionId);
    }
}
