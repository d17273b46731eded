package com.ureca.eventbus.subscription.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import static com.ureca.eventbus.common.BaseCode.INVALID_SUBSCRIPTION_PATTERN;

public class InvalidSubscriptionException extends BusinessException {

    public InvalidSubscriptionException(String message) {
        super(INVALID_SUBSCRIPTION_PATTERN, message);
    }
}
