package com.ureca.eventbus.event.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import java.util.UUID;

import static com.ureca.eventbus.common.BaseCode.EVENT_NOT_FOUND;

public class EventNotFoundException extends BusinessException {

    public EventNotFoundException(UUID eventId) {
        super(EVENT_NOT_FOUND, "이벤트 없음. eventId: " + eventId);
    }
}
