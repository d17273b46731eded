package com.ureca.eventbus.event.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import static com.ureca.eventbus.common.BaseCode.INVALID_EVENT_REQUEST;

public class InvalidEventRequestException extends BusinessException {

    public InvalidEventRequestException(String message) {
        super(INVALID_EVENT_REQUEST, message);
    }
}
